package cz.vut.fit.resolverradar.analyzer.probe;

import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import cz.vut.fit.resolverradar.analyzer.StepTicker;
import cz.vut.fit.resolverradar.models.ResponseCodes;
import cz.vut.fit.resolverradar.models.TestType;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.*;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static cz.vut.fit.resolverradar.analyzer.probe.ScriptedTransport.*;
import static org.junit.jupiter.api.Assertions.*;

class ProbeEngineTest {
    private static final String SERVER = "198.51.100.53";

    private final AnalyzerSettings _settings = AnalyzerSettings.defaults();

    @Test
    void answeredProbeMeasuresRoundTripTime() throws Exception {
        final var transport = new ScriptedTransport().on("google.com", answer(300));
        final var engine = new ProbeEngine(transport, _settings, StepTicker.ofMicros(12_345));

        final var outcome = engine.probe(SERVER, ProbeRequest.latency(_settings));

        final var answered = assertInstanceOf(ProbeOutcome.Answered.class, outcome);
        assertEquals(12.345, answered.rttMs(), 1e-9);
        assertEquals("NOERROR", outcome.rcode());
        assertTrue(DnsMessages.hasAnswer(answered.response()));
    }

    @Test
    void responseCodeIsKeptForNonZeroRcode() throws Exception {
        final var transport = new ScriptedTransport().on("google.com", rcode(Rcode.REFUSED));
        final var engine = new ProbeEngine(transport, _settings, StepTicker.ofMicros(1_000));

        final var outcome = engine.probe(SERVER, ProbeRequest.latency(_settings));

        assertInstanceOf(ProbeOutcome.Answered.class, outcome);
        assertEquals("REFUSED", outcome.rcode());
    }

    @Test
    void socketTimeoutBecomesTimedOutWithTheTimeout() throws Exception {
        final var engine = new ProbeEngine(new ScriptedTransport().otherwise(timeout()), _settings,
                StepTicker.ofMicros(1_000));

        final var outcome = engine.probe(SERVER, ProbeRequest.recursion(_settings));

        final var timedOut = assertInstanceOf(ProbeOutcome.TimedOut.class, outcome);
        assertEquals(_settings.dnsTimeout().toMillis(), timedOut.waitedMs(), 1e-9);
        assertEquals(ResponseCodes.TIMEOUT, outcome.rcode());
    }

    @Test
    void wrappedTimeoutIsRecognized() throws Exception {
        final DnsTransport transport = (server, query, timeout) -> {
            throw new IOException("Lookup failed", new TimeoutException("Query timed out"));
        };
        final var engine = new ProbeEngine(transport, _settings);

        assertInstanceOf(ProbeOutcome.TimedOut.class, engine.probe(SERVER, ProbeRequest.recursion(_settings)));
    }

    @Test
    void transportFailureBecomesErrorWithoutRetry() throws Exception {
        final var transport = new ScriptedTransport().otherwise(error("Malformed response"));
        final var engine = new ProbeEngine(transport, _settings);

        final var outcome = engine.probe(SERVER, ProbeRequest.malicious(_settings));

        final var error = assertInstanceOf(ProbeOutcome.TransportError.class, outcome);
        assertEquals("Malformed response", error.message());
        assertEquals(ResponseCodes.ERROR, outcome.rcode());
        assertEquals(1, transport.sent().size());
    }

    @Test
    void runtimeFailureWithoutMessageUsesTheExceptionName() throws Exception {
        final DnsTransport transport = (server, query, timeout) -> {
            throw new IllegalStateException();
        };
        final var engine = new ProbeEngine(transport, _settings);

        final var outcome = engine.probe(SERVER, ProbeRequest.malicious(_settings));

        assertEquals("IllegalStateException",
                assertInstanceOf(ProbeOutcome.TransportError.class, outcome).message());
    }

    @Test
    void invalidQueryNameIsReportedAsError() throws Exception {
        final var transport = new ScriptedTransport();
        final var engine = new ProbeEngine(transport, _settings);
        final var request = new ProbeRequest(TestType.LATENCY, "bad..name", Type.A, true, false);

        assertInstanceOf(ProbeOutcome.TransportError.class, engine.probe(SERVER, request));
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void interruptDuringExchangePropagates() {
        final DnsTransport transport = (server, query, timeout) -> {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted");
        };
        final var engine = new ProbeEngine(transport, _settings);

        assertThrows(InterruptedException.class, () -> engine.probe(SERVER, ProbeRequest.latency(_settings)));
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    void queryIsSentWithTheConfiguredTimeoutAndFlags() throws Exception {
        final var transport = new ScriptedTransport().on("iifon.org", answer(60, Flags.AD));
        final var engine = new ProbeEngine(transport, _settings);

        engine.probe(SERVER, ProbeRequest.dnssec(_settings));

        final var sent = transport.sent().get(0);
        assertEquals(SERVER, sent.server());
        assertEquals(Duration.ofMillis(5000), sent.timeout());
        assertTrue(sent.query().getHeader().getFlag(Flags.RD));
        final var opt = sent.query().getOPT();
        assertNotNull(opt);
        assertEquals(_settings.dnssecUdpPayload(), opt.getPayloadSize());
        assertEquals(ExtendedFlags.DO, opt.getFlags() & ExtendedFlags.DO);
    }
}
