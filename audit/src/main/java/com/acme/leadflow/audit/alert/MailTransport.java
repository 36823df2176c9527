package com.acme.leadflow.audit.alert;

import jakarta.mail.MessagingException;

import java.util.List;

@FunctionalInterface
public interface MailTransport {
    void send(String from, List<String> to, String subject, String body) throws MessagingException;
}
