package org.bacteria.service.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CredentialContext")
class CredentialContextTest {

    @Test
    @DisplayName("a blank cookie counts as missing")
    void blankIsMissing() {
        assertThat(new CredentialContext(null).isPresent()).isFalse();
        assertThat(new CredentialContext("  ").isPresent()).isFalse();
        assertThatThrownBy(() -> new CredentialContext("").sessionCookie())
                .isInstanceOf(MissingCredentialException.class);
    }

    @Test
    @DisplayName("never prints the cookie value")
    void hidesValue() {
        CredentialContext context = new CredentialContext("s3cr3t");

        assertThat(context.sessionCookie()).isEqualTo("s3cr3t");
        assertThat(context.toString()).doesNotContain("s3cr3t").contains("present=true");
    }
}
