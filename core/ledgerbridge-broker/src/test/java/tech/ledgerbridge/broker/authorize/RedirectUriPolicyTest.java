package tech.ledgerbridge.broker.authorize;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tech.ledgerbridge.broker.TestBrokerConfig;

import static org.assertj.core.api.Assertions.*;

class RedirectUriPolicyTest {

    private RedirectUriPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new RedirectUriPolicy();
        policy.config = new TestBrokerConfig();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "https://claude.ai/api/mcp/auth_callback",
        "https://CLAUDE.AI/api/mcp/auth_callback",
        "http://localhost:6274/oauth/callback",
        "http://127.0.0.1:33418/callback?x=1"
    })
    @DisplayName("isAllowed should accept allow-listed hosts")
    void isAllowed_shouldAccept_whenHostAllowListed(String uri) {
        assertThat(policy.isAllowed(uri)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "https://claude.ai.evil.example/callback",
        "https://evil.example/claude.ai",
        "https://evil.example/?next=https://claude.ai",
        "https://claude.ai@evil.example/callback",
        "https://notclaude.ai/callback",
        "javascript://claude.ai/%0Aalert(1)",
        "https://claude.ai/callback#fragment",
        "/relative/callback",
        "not a uri",
        ""
    })
    @DisplayName("isAllowed should reject lookalike and malformed targets")
    void isAllowed_shouldReject_whenHostNotAllowListed(String uri) {
        assertThat(policy.isAllowed(uri)).isFalse();
    }
}
