package com.salesdesk.backend.global.common.email;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable email address with independent {@code invalid} and {@code optedOut} flags.
 * Every flag change returns a new instance; the address text never changes after parsing.
 */
public final class EmailAddress {

    private static final int MAX_LENGTH = 254;

    private static final Pattern ADDRESS_PATTERN = Pattern.compile(
            "^[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+(\\.[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+)*"
                    + "@([A-Za-z0-9]([A-Za-z0-9-]{0,61}[A-Za-z0-9])?\\.)+[A-Za-z]{2,63}$"
    );

    private final String address;
    private final boolean invalid;
    private final boolean optedOut;

    private EmailAddress(String address, boolean invalid, boolean optedOut) {
        this.address = address;
        this.invalid = invalid;
        this.optedOut = optedOut;
    }

    public static EmailAddress parse(String raw) {
        if (raw == null) {
            throw new InvalidEmailAddressException(null);
        }
        String trimmed = raw.trim();
        if (trimmed.length() > MAX_LENGTH || !ADDRESS_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidEmailAddressException(raw);
        }
        return new EmailAddress(trimmed, false, false);
    }

    /**
     * Rebuilds a stored value as it was persisted. The address is not re-validated,
     * so rows written under other rules still load.
     */
    public static EmailAddress of(String stored, boolean invalid, boolean optedOut) {
        Objects.requireNonNull(stored, "stored");
        return new EmailAddress(stored, invalid, optedOut);
    }

    public String getAddress() {
        return address;
    }

    public boolean isInvalid() {
        return invalid;
    }

    public boolean isOptedOut() {
        return optedOut;
    }

    public EmailAddress withInvalid() {
        return new EmailAddress(address, true, optedOut);
    }

    public EmailAddress withoutInvalid() {
        return new EmailAddress(address, false, optedOut);
    }

    public EmailAddress withOptedOut() {
        return new EmailAddress(address, invalid, true);
    }

    public EmailAddress withoutOptedOut() {
        return new EmailAddress(address, invalid, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EmailAddress that)) {
            return false;
        }
        return invalid == that.invalid && optedOut == that.optedOut && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, invalid, optedOut);
    }

    @Override
    public String toString() {
        return address;
    }
}
