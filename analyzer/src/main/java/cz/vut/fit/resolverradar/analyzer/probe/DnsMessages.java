package cz.vut.fit.resolverradar.analyzer.probe;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.xbill.DNS.*;
import org.xbill.DNS.Record;

import java.util.ArrayList;
import java.util.stream.Collectors;

/**
 * Helpers for reading the fields of DNS responses that the analysis works with.
 */
public final class DnsMessages {
    private static final int[] REPORTED_FLAGS = {Flags.AA, Flags.TC, Flags.RD, Flags.RA, Flags.AD, Flags.CD};

    private DnsMessages() {
    }

    public static @NotNull String rcode(@NotNull Message message) {
        return Rcode.string(message.getRcode());
    }

    public static boolean hasFlag(@NotNull Message message, int flag) {
        return message.getHeader().getFlag(flag);
    }

    public static boolean hasAnswer(@NotNull Message message) {
        return !message.getSection(Section.ANSWER).isEmpty();
    }

    /**
     * Formats the header flags word and the names of the set flags, e.g. {@code 0x8180 (RD|RA)}.
     * The word contains the QR bit, the opcode, the flag bits and the low four bits of the response code.
     */
    public static @NotNull String flags(@NotNull Message message) {
        final var header = message.getHeader();
        int word = ((header.getOpcode() & 0xF) << 11) | (header.getRcode() & 0xF);
        if (header.getFlag(Flags.QR)) {
            word |= 1 << 15;
        }

        final var names = new ArrayList<String>();
        for (var flag : REPORTED_FLAGS) {
            if (header.getFlag(flag)) {
                word |= 1 << (15 - flag);
                names.add(Flags.string(flag).toUpperCase());
            }
        }

        return String.format("0x%04x (%s)", word, names.isEmpty() ? "NONE" : String.join("|", names));
    }

    /**
     * Returns the answer section in presentation format, one record per line, or null if it is empty.
     */
    public static @Nullable String answerText(@NotNull Message message) {
        final var answer = message.getSection(Section.ANSWER);
        if (answer.isEmpty())
            return null;

        return answer.stream()
                .map(Record::toString)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Returns the TTL of the first record in the answer section, or null if it is empty.
     */
    public static @Nullable Long firstAnswerTtl(@NotNull Message message) {
        final var answer = message.getSection(Section.ANSWER);
        if (answer.isEmpty())
            return null;

        return answer.get(0).getTTL();
    }
}
