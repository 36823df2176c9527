package com.acme.leadflow.audit.alert;

import com.acme.leadflow.audit.util.AuditDefaults;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * SMTP delivery with mandatory STARTTLS.
 */
public final class SmtpMailTransport implements MailTransport {
    private final Session session;

    public SmtpMailTransport(String host, int port, String username, String password) {
        Objects.requireNonNull(host, "host");
        Properties props = new Properties();
        props.put("mail.smtp.host", host);
        props.put("mail.smtp.port", Integer.toString(port));
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.starttls.required", "true");
        props.put("mail.smtp.ssl.checkserveridentity", "true");
        props.put("mail.smtp.connectiontimeout", Integer.toString(AuditDefaults.CHAT_WEBHOOK_TIMEOUT_MS));
        props.put("mail.smtp.timeout", Integer.toString(AuditDefaults.CHAT_WEBHOOK_TIMEOUT_MS));
        boolean auth = username != null && !username.isBlank();
        props.put("mail.smtp.auth", Boolean.toString(auth));
        this.session = auth
            ? Session.getInstance(props, new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    return new PasswordAuthentication(username, password == null ? "" : password);
                }
            })
            : Session.getInstance(props);
    }

    @Override
    public void send(String from, List<String> to, String subject, String body) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(from, true));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(String.join(",", to), true));
        message.setSubject(subject, StandardCharsets.UTF_8.name());
        message.setText(body, StandardCharsets.UTF_8.name());
        Transport.send(message);
    }
}
