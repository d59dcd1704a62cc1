package com.verso.registry.domain.email;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Locale;

public class EmailIdentity {
    private String name;
    private String address;

    public EmailIdentity() {
    }

    public EmailIdentity(String name, String address) {
        this.name = name;
        this.address = address;
    }

    @JsonIgnore
    public boolean isValid() {
        return address != null && address.contains("@");
    }

    public String normalizedAddress() {
        return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    @Override
    public String toString() {
        return name == null || name.isBlank() ? address : name + " <" + address + ">";
    }
}
