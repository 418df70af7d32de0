package cz.vut.fit.resolverradar.analyzer.checks;

import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeOutcome;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeRequest;
import cz.vut.fit.resolverradar.analyzer.probe.ScriptedTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Message;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Section;

import static org.junit.jupiter.api.Assertions.*;

class ProbeChecksTest {
    private final AnalyzerSettings _settings = AnalyzerSettings.defaults();

    private ProbeOutcome answered(ScriptedTransport.Responder responder) throws Exception {
        final Message query = ProbeRequest.recursion(_settings).toQuery(1232);
        return new ProbeOutcome.Answered(responder.respond(query), 10.0);
    }

    @Test
    void recursiveNeedsRaAnswerAndNoError() throws Exception {
        final var check = RecursionCheck.from(answered(ScriptedTransport.answer(300)));

        assertTrue(check.isRecursive());
        assertTrue(check.raFlagSet());
        assertEquals("NOERROR", check.rcode());
    }

    @Test
    void notRecursiveWithoutRa() throws Exception {
        final var outcome = answered(query -> {
            final var response = ScriptedTransport.answer(300).respond(query);
            response.getHeader().unsetFlag(Flags.RA);
            return response;
        });

        final var check = RecursionCheck.from(outcome);
        assertFalse(check.isRecursive());
        assertFalse(check.raFlagSet());
    }

    @Test
    void notRecursiveWithEmptyAnswer() throws Exception {
        final var check = RecursionCheck.from(answered(ScriptedTransport.rcode(Rcode.NOERROR, Flags.RA)));

        assertFalse(check.isRecursive());
        assertTrue(check.raFlagSet());
    }

    @Test
    void notRecursiveWithErrorRcode() throws Exception {
        final var outcome = answered(query -> {
            final var response = ScriptedTransport.answer(300).respond(query);
            response.getHeader().setRcode(Rcode.SERVFAIL);
            return response;
        });

        final var check = RecursionCheck.from(outcome);
        assertFalse(check.isRecursive());
        assertEquals("SERVFAIL", check.rcode());
    }

    @Test
    void recursionTimeout() {
        final var check = RecursionCheck.from(new ProbeOutcome.TimedOut(5000));

        assertFalse(check.isRecursive());
        assertFalse(check.raFlagSet());
        assertEquals("TIMEOUT", check.rcode());
    }

    @Test
    void latencyIsKeptForAnyResponse() throws Exception {
        final Message query = ProbeRequest.latency(_settings).toQuery(1232);
        final var refused = ScriptedTransport.rcode(Rcode.REFUSED).respond(query);

        final var check = LatencyCheck.from(new ProbeOutcome.Answered(refused, 23.45678));

        assertEquals(23.457, check.latencyMs());
        assertEquals("REFUSED", check.rcode());
        assertNull(LatencyCheck.from(new ProbeOutcome.TimedOut(5000)).latencyMs());
        assertNull(LatencyCheck.from(new ProbeOutcome.TransportError("x")).latencyMs());
    }

    @Test
    void dnssecValidatesWithAdAndNoError() throws Exception {
        final var check = DnssecCheck.from(answered(ScriptedTransport.answer(300, Flags.AD)));

        assertTrue(check.validates());
        assertTrue(check.adFlagSet());
    }

    @Test
    void dnssecDoesNotValidateWithoutAd() throws Exception {
        final var check = DnssecCheck.from(answered(ScriptedTransport.answer(300)));

        assertFalse(check.validates());
        assertFalse(check.adFlagSet());
    }

    @Test
    void dnssecAdWithErrorRcodeDoesNotValidate() throws Exception {
        final var check = DnssecCheck.from(answered(ScriptedTransport.rcode(Rcode.SERVFAIL, Flags.RA, Flags.AD)));

        assertFalse(check.validates());
        assertTrue(check.adFlagSet());
        assertEquals("SERVFAIL", check.rcode());
    }

    @Test
    void maliciousBlockedByNxdomain() throws Exception {
        final var check = MaliciousCheck.from(answered(ScriptedTransport.rcode(Rcode.NXDOMAIN, Flags.RA)));

        assertTrue(check.blocks());
        assertEquals("NXDOMAIN", check.rcode());
    }

    @Test
    void maliciousBlockedByEmptyAnswer() throws Exception {
        assertTrue(MaliciousCheck.from(answered(ScriptedTransport.rcode(Rcode.NOERROR, Flags.RA))).blocks());
    }

    @Test
    void maliciousResolvedIsNotBlocked() throws Exception {
        final var check = MaliciousCheck.from(answered(ScriptedTransport.answer(300)));

        assertFalse(check.blocks());
        assertEquals("NOERROR", check.rcode());
    }

    @ParameterizedTest(name = "{index} => rcode={0}")
    @ValueSource(strings = {"NXDOMAIN", "SERVFAIL", "REFUSED"})
    void maliciousWithAnswerButBlockingRcodeIsBlocked(String rcode) throws Exception {
        final var outcome = answered(query -> {
            final var response = ScriptedTransport.answer(300).respond(query);
            response.getHeader().setRcode(Rcode.value(rcode));
            return response;
        });

        final var check = MaliciousCheck.from(outcome);

        assertTrue(check.blocks(), "A " + rcode + " response should count as blocking even with an answer.");
        assertEquals(rcode, check.rcode());
    }

    @Test
    void maliciousUnansweredIsNotBlocked() {
        final var check = MaliciousCheck.from(new ProbeOutcome.TransportError("boom"));

        assertFalse(check.blocks());
        assertEquals("ERROR", check.rcode());
    }

    @Test
    void answerFixtureHasOneRecord() throws Exception {
        final var outcome = (ProbeOutcome.Answered) answered(ScriptedTransport.answer(300));

        assertEquals(1, outcome.response().getSection(Section.ANSWER).size());
    }
}
