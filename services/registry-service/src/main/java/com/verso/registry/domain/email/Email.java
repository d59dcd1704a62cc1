package com.verso.registry.domain.email;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.verso.registry.domain.VersionedEntity;
import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Email extends VersionedEntity {
    private EmailIdentity from;
    private List<EmailIdentity> to = new ArrayList<>();
    private List<EmailIdentity> cc = new ArrayList<>();
    private List<EmailIdentity> bcc = new ArrayList<>();
    private String subject;
    private String bodyText;
    private String bodyHtml;
    private String eventMessage;
    private EmailStatus status;

    /**
     * Every distinct sender and recipient address, lower-cased.
     */
    public List<String> allAddresses() {
        List<String> addresses = new ArrayList<>();
        addAddress(addresses, from);
        for (List<EmailIdentity> group : List.of(to, cc, bcc)) {
            for (EmailIdentity identity : group) {
                addAddress(addresses, identity);
            }
        }
        return addresses;
    }

    private static void addAddress(List<String> addresses, EmailIdentity identity) {
        if (identity == null || !identity.isValid()) {
            return;
        }
        String address = identity.normalizedAddress();
        if (!addresses.contains(address)) {
            addresses.add(address);
        }
    }

    public String statusName() {
        return status == null ? null : status.name();
    }

    @Override
    public List<String> validate() {
        List<String> problems = super.validate();
        if (from == null || !from.isValid()) {
            problems.add("From address is missing or invalid");
        }
        if (to.isEmpty()) {
            problems.add("To address is missing");
        }
        for (EmailIdentity identity : to) {
            if (!identity.isValid()) {
                problems.add("To address is invalid: " + identity.getAddress());
            }
        }
        if (subject == null || subject.isBlank()) {
            problems.add("Subject is missing");
        }
        if (status == null) {
            problems.add("Status is missing");
        }
        return problems;
    }

    public EmailIdentity getFrom() {
        return from;
    }

    public void setFrom(EmailIdentity from) {
        this.from = from;
    }

    public List<EmailIdentity> getTo() {
        return to;
    }

    public void setTo(List<EmailIdentity> to) {
        this.to = to == null ? new ArrayList<>() : to;
    }

    public List<EmailIdentity> getCc() {
        return cc;
    }

    public void setCc(List<EmailIdentity> cc) {
        this.cc = cc == null ? new ArrayList<>() : cc;
    }

    public List<EmailIdentity> getBcc() {
        return bcc;
    }

    public void setBcc(List<EmailIdentity> bcc) {
        this.bcc = bcc == null ? new ArrayList<>() : bcc;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getBodyText() {
        return bodyText;
    }

    public void setBodyText(String bodyText) {
        this.bodyText = bodyText;
    }

    public String getBodyHtml() {
        return bodyHtml;
    }

    public void setBodyHtml(String bodyHtml) {
        this.bodyHtml = bodyHtml;
    }

    public String getEventMessage() {
        return eventMessage;
    }

    public void setEventMessage(String eventMessage) {
        this.eventMessage = eventMessage;
    }

    public EmailStatus getStatus() {
        return status;
    }

    public void setStatus(EmailStatus status) {
        this.status = status;
    }
}
