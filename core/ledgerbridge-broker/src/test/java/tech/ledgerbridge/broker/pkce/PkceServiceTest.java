package tech.ledgerbridge.broker.pkce;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

class PkceServiceTest {

    private final PkceService service = new PkceService();
    private final SecureRandom random = new SecureRandom();

    private String randomVerifier() {
        byte[] bytes = new byte[48];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    // ========================================
    // computeS256Challenge TESTS
    // ========================================

    @Test
    @DisplayName("computeS256Challenge should match the RFC 7636 appendix B example")
    void computeS256Challenge_shouldMatchRfcExample() {
        String challenge = service.computeS256Challenge("dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk");

        assertThat(challenge).isEqualTo("E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM");
    }

    // ========================================
    // verify TESTS
    // ========================================

    @RepeatedTest(20)
    @DisplayName("verify should accept S256 verifier against its own challenge")
    void verify_shouldAccept_whenS256ChallengeComputedFromVerifier() {
        String verifier = randomVerifier();

        assertThat(service.verify(ChallengeMethod.S256, verifier, service.computeS256Challenge(verifier))).isTrue();
    }

    @RepeatedTest(20)
    @DisplayName("verify should reject S256 verifier with a single flipped bit")
    void verify_shouldReject_whenVerifierHasOneBitFlipped() {
        String verifier = randomVerifier();
        String challenge = service.computeS256Challenge(verifier);

        char[] chars = verifier.toCharArray();
        int index = random.nextInt(chars.length);
        chars[index] = (char) (chars[index] ^ 1);
        String mutated = new String(chars);

        assertThat(service.verify(ChallengeMethod.S256, mutated, challenge)).isFalse();
    }

    @Test
    @DisplayName("verify should compare plain challenges directly")
    void verify_shouldCompareDirectly_whenMethodIsPlain() {
        String verifier = randomVerifier();

        assertThat(service.verify(ChallengeMethod.PLAIN, verifier, verifier)).isTrue();
        assertThat(service.verify(ChallengeMethod.PLAIN, verifier, verifier + "x")).isFalse();
    }

    @Test
    @DisplayName("verify should not accept S256 hash as plain verifier")
    void verify_shouldReject_whenMethodsAreMixed() {
        String verifier = randomVerifier();
        String challenge = service.computeS256Challenge(verifier);

        assertThat(service.verify(ChallengeMethod.PLAIN, verifier, challenge)).isFalse();
        assertThat(service.verify(ChallengeMethod.S256, challenge, challenge)).isFalse();
    }

    @Test
    @DisplayName("verify should reject null inputs")
    void verify_shouldReject_whenInputsNull() {
        assertThat(service.verify(null, "a", "b")).isFalse();
        assertThat(service.verify(ChallengeMethod.S256, null, "b")).isFalse();
        assertThat(service.verify(ChallengeMethod.S256, "a", null)).isFalse();
    }

    // ========================================
    // isValidCodeVerifier TESTS
    // ========================================

    @Test
    @DisplayName("isValidCodeVerifier should enforce length 43 to 128")
    void isValidCodeVerifier_shouldEnforceLength() {
        assertThat(service.isValidCodeVerifier("a".repeat(42))).isFalse();
        assertThat(service.isValidCodeVerifier("a".repeat(43))).isTrue();
        assertThat(service.isValidCodeVerifier("a".repeat(128))).isTrue();
        assertThat(service.isValidCodeVerifier("a".repeat(129))).isFalse();
    }

    @Test
    @DisplayName("isValidCodeVerifier should only allow unreserved characters")
    void isValidCodeVerifier_shouldRejectReservedCharacters() {
        assertThat(service.isValidCodeVerifier("abc-._~" + "A".repeat(40))).isTrue();
        assertThat(service.isValidCodeVerifier("abc+/=" + "A".repeat(40))).isFalse();
        assertThat(service.isValidCodeVerifier(null)).isFalse();
    }

    // ========================================
    // ChallengeMethod TESTS
    // ========================================

    @Test
    @DisplayName("fromParameter should accept exactly S256 and plain")
    void fromParameter_shouldAcceptExactValues() {
        assertThat(ChallengeMethod.fromParameter("S256")).contains(ChallengeMethod.S256);
        assertThat(ChallengeMethod.fromParameter("plain")).contains(ChallengeMethod.PLAIN);
        assertThat(ChallengeMethod.fromParameter("s256")).isEmpty();
        assertThat(ChallengeMethod.fromParameter("RS256")).isEmpty();
        assertThat(ChallengeMethod.fromParameter(null)).isEmpty();
    }
}
