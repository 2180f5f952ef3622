package com.mimecast.anomalymail.config;

import java.util.Objects;

/**
 * Email party, sender or recipient.
 *
 * <p>Display name may be empty, address is always a validated <code>local@domain</code>.
 */
public final class Party {
    private final String name;
    private final String address;

    Party(String name, String address) {
        this.name = name != null ? name : "";
        this.address = Objects.requireNonNull(address, "address");
    }

    /**
     * Gets display name.
     *
     * @return Name string, possibly empty.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets address.
     *
     * @return Address string.
     */
    public String getAddress() {
        return address;
    }

    /**
     * Gets address local part.
     *
     * @return Local part string.
     */
    public String getLocalPart() {
        return address.substring(0, address.indexOf('@'));
    }

    /**
     * Gets address domain.
     *
     * @return Domain string.
     */
    public String getDomain() {
        return address.substring(address.indexOf('@') + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Party party = (Party) o;
        return name.equals(party.name) && address.equals(party.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, address);
    }

    @Override
    public String toString() {
        return name.isEmpty() ? address : name + " <" + address + ">";
    }
}
