package com.acme.leadflow.audit.alert;

import com.acme.leadflow.audit.security.EmailValidator;

import java.util.List;
import java.util.Objects;

/**
 * Sends alert summaries by email. Subject and body are sanitized against header and SMTP
 * injection before they reach the transport.
 */
public final class EmailAlertSink implements AlertSink {
    static final int SUBJECT_PREVIEW = 50;
    static final int MAX_SUBJECT = 200;
    static final int MAX_BODY = 10_000;
    static final String TRUNCATED = "...[truncated]";

    private final MailTransport transport;
    private final String from;
    private final List<String> to;

    /**
     * @throws com.acme.leadflow.audit.security.AuditValidationException if any address is invalid
     */
    public EmailAlertSink(MailTransport transport, String from, List<String> to) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.from = EmailValidator.validate(from);
        if (to == null || to.isEmpty()) {
            throw new IllegalArgumentException("at least one recipient required");
        }
        this.to = to.stream().map(EmailValidator::validate).toList();
    }

    @Override
    public void notify(String message) throws Exception {
        String text = message == null ? "" : message;
        transport.send(from, to, subject(text), body(text));
    }

    static String subject(String message) {
        String preview = message.length() > SUBJECT_PREVIEW ? message.substring(0, SUBJECT_PREVIEW) : message;
        String subject = ("Audit Alert: " + preview)
            .replace('\r', ' ')
            .replace('\n', ' ')
            .replace('\t', ' ');
        return subject.length() > MAX_SUBJECT ? subject.substring(0, MAX_SUBJECT) : subject;
    }

    static String body(String message) {
        String neutralized = message.replace("\r\n.\r\n", "\r\n. \r\n");
        StringBuilder sb = new StringBuilder(neutralized.length());
        for (int i = 0; i < neutralized.length(); i++) {
            char c = neutralized.charAt(i);
            if (c >= 32 || c == '\n' || c == '\r' || c == '\t') {
                sb.append(c);
            }
        }
        if (sb.length() > MAX_BODY) {
            sb.setLength(MAX_BODY);
            sb.append(TRUNCATED);
        }
        return sb.toString();
    }
}
