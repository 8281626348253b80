package com.salesdesk.backend.global.common.email;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class EmailAddressTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "test@test.com",
            "jane.doe@example.com",
            "first+tag@sub.example.co.uk",
            "o'brien@example.ie",
            "x@a-b.io"
    })
    @DisplayName("올바른 주소는 입력값 그대로 파싱된다")
    void parsesValidAddresses(String raw) {
        EmailAddress address = EmailAddress.parse(raw);

        assertThat(address.getAddress()).isEqualTo(raw);
        assertThat(address.isInvalid()).isFalse();
        assertThat(address.isOptedOut()).isFalse();
    }

    @Test
    void trimsSurroundingWhitespace() {
        assertThat(EmailAddress.parse("  test@test.com \t").getAddress()).isEqualTo("test@test.com");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "one",
            "one@",
            "@example.com",
            "one@example",
            "one two@example.com",
            "one@@example.com",
            ".one@example.com",
            "one..two@example.com",
            "one@-example.com",
            "one@example.c"
    })
    @DisplayName("잘못된 주소는 InvalidEmailAddressException을 던진다")
    void rejectsInvalidAddresses(String raw) {
        assertThatThrownBy(() -> EmailAddress.parse(raw))
                .isInstanceOf(InvalidEmailAddressException.class)
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsAddressLongerThan254Characters() {
        String local = "a".repeat(64);
        String domain = "b".repeat(63) + "." + "c".repeat(63) + "." + "d".repeat(63) + ".com";
        String raw = local + "@" + domain;

        assertThat(raw.length()).isGreaterThan(254);
        assertThatThrownBy(() -> EmailAddress.parse(raw)).isInstanceOf(InvalidEmailAddressException.class);
    }

    @Test
    void withInvalidKeepsAddressAndOptedOut() {
        EmailAddress address = EmailAddress.parse("test@test.com").withInvalid();

        assertThat(address.getAddress()).isEqualTo("test@test.com");
        assertThat(address.isInvalid()).isTrue();
        assertThat(address.isOptedOut()).isFalse();
    }

    @Test
    void withOptedOutKeepsInvalid() {
        EmailAddress address = EmailAddress.parse("test@test.com").withOptedOut();

        assertThat(address.isInvalid()).isFalse();
        assertThat(address.isOptedOut()).isTrue();
    }

    @Test
    void togglingOneFlagNeverChangesTheOther() {
        EmailAddress optedOut = EmailAddress.parse("test@test.com").withOptedOut();

        assertThat(optedOut.withInvalid().isOptedOut()).isTrue();
        assertThat(optedOut.withoutInvalid().isOptedOut()).isTrue();

        EmailAddress invalid = EmailAddress.parse("test@test.com").withInvalid();
        assertThat(invalid.withOptedOut().isInvalid()).isTrue();
        assertThat(invalid.withoutOptedOut().isInvalid()).isTrue();
    }

    @Test
    void withThenWithoutRestoresTheOriginalValue() {
        EmailAddress original = EmailAddress.parse("test@test.com").withOptedOut();

        assertThat(original.withInvalid().withoutInvalid()).isEqualTo(original);
        assertThat(original.withoutOptedOut().withOptedOut()).isEqualTo(original);

        EmailAddress cleared = EmailAddress.parse("test@test.com")
                .withOptedOut()
                .withoutOptedOut()
                .withInvalid()
                .withoutInvalid();
        assertThat(cleared.isInvalid()).isFalse();
        assertThat(cleared.isOptedOut()).isFalse();
    }

    @Test
    @DisplayName("플래그 변경은 새 인스턴스를 반환하고 원본은 그대로 둔다")
    void flagChangesReturnNewInstances() {
        EmailAddress original = EmailAddress.parse("test@test.com");

        EmailAddress invalid = original.withInvalid();
        EmailAddress optedOut = original.withOptedOut();
        EmailAddress notInvalid = original.withoutInvalid();
        EmailAddress notOptedOut = original.withoutOptedOut();

        assertThat(invalid).isNotSameAs(original);
        assertThat(optedOut).isNotSameAs(original);
        assertThat(notInvalid).isNotSameAs(original);
        assertThat(notOptedOut).isNotSameAs(original);
        assertThat(original.isInvalid()).isFalse();
        assertThat(original.isOptedOut()).isFalse();
    }

    @Test
    void equalityCoversAddressAndBothFlags() {
        EmailAddress address = EmailAddress.parse("test@test.com");

        assertThat(address).isEqualTo(EmailAddress.parse("test@test.com"));
        assertThat(address).hasSameHashCodeAs(EmailAddress.parse("test@test.com"));
        assertThat(address).isNotEqualTo(address.withInvalid());
        assertThat(address).isNotEqualTo(address.withOptedOut());
        assertThat(address).isNotEqualTo(EmailAddress.parse("other@test.com"));
    }

    @Test
    void ofRestoresStoredFlags() {
        EmailAddress restored = EmailAddress.of("test@test.com", true, true);

        assertThat(restored).isEqualTo(EmailAddress.parse("test@test.com").withInvalid().withOptedOut());
    }

    @Test
    void ofKeepsStoredAddressThatParsingWouldReject() {
        EmailAddress restored = EmailAddress.of("legacy@localhost", false, true);

        assertThat(restored.getAddress()).isEqualTo("legacy@localhost");
        assertThat(restored.isOptedOut()).isTrue();
        assertThatThrownBy(() -> EmailAddress.parse("legacy@localhost")).isInstanceOf(InvalidEmailAddressException.class);
    }
}
