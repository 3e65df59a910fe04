package com.dealwatch.output;

import com.dealwatch.config.Config;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * SMTP mail sender.
 */
public class Mailer {
    private static final Logger LOG = LogManager.getLogger(Mailer.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS")
            .withZone(ZoneId.systemDefault());

    public static final class Settings {
        public boolean enabled;
        public String host;
        public int port;
        public String user;
        public String pass;
        public String from;
        public List<String> to;
        public String subjectPrefix;
        public boolean dryRun;
        public boolean failFast;
        public Path dryRunDir;
    }

    public static Settings loadSettings(Config config) {
        Settings settings = new Settings();
        settings.enabled = config.getBoolean("email.enabled", true);
        settings.host = config.getString("email.smtp_host", "smtp.gmail.com");
        settings.port = config.getInt("email.smtp_port", 587);
        settings.user = config.getString("email.smtp_user", "");
        settings.pass = config.getString("email.smtp_pass", "");
        settings.from = config.getString("email.from", settings.user);
        settings.to = config.getList("email.to");
        settings.subjectPrefix = config.getString("email.subject_prefix", "Kindle Alert:");
        settings.dryRun = config.getBoolean("mail.dry_run", false);
        settings.failFast = config.getBoolean("mail.fail_fast", false);
        settings.dryRunDir = config.getPath("mail.dry_run.dir");
        return settings;
    }

    /**
     * Sends a multipart/alternative message with a plain-text and an HTML part.
     *
     * @return {@code true} only when the message was handed to the SMTP server (or written in
     *         dry-run mode)
     * @throws MessagingException only when {@code mail.fail_fast} is set
     */
    public boolean send(Settings s, String subject, String textBody, String htmlBody) throws MessagingException {
        if (!s.enabled) {
            LOG.warn("Email disabled (email.enabled=false); message '{}' not sent", subject);
            return false;
        }

        String safeSubject = subject == null ? "" : subject;
        String safeText = textBody == null ? "" : textBody;
        String safeHtml = htmlBody == null ? "" : htmlBody;

        if (s.dryRun) {
            try {
                writeDryRunArtifacts(s, safeSubject, safeText, safeHtml);
                LOG.info("Mail dry-run saved. dir={}", s.dryRunDir.toAbsolutePath());
                return true;
            } catch (Exception e) {
                handleFailure(s, "dry_run_write_failed", e);
            }
            return false;
        }

        if (isBlank(s.host) || isBlank(s.user) || isBlank(s.pass) || s.to == null || s.to.isEmpty()) {
            handleFailure(s, "smtp_settings_incomplete",
                    new IllegalArgumentException("email enabled but smtp settings are incomplete"));
            return false;
        }

        try {
            Session session = Session.getInstance(smtpProperties(s), new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    return new PasswordAuthentication(s.user, s.pass);
                }
            });

            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(isBlank(s.from) ? s.user : s.from));
            String toJoined = s.to.stream().map(String::trim).filter(v -> !v.isEmpty()).collect(Collectors.joining(","));
            message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(toJoined));
            message.setSubject(safeSubject, "UTF-8");

            MimeMultipart alternative = new MimeMultipart("alternative");
            MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(safeText, "UTF-8");
            alternative.addBodyPart(textPart);
            if (!safeHtml.trim().isEmpty()) {
                MimeBodyPart htmlPart = new MimeBodyPart();
                htmlPart.setContent(safeHtml, "text/html; charset=UTF-8");
                alternative.addBodyPart(htmlPart);
            }
            message.setContent(alternative);

            transport(message);
            LOG.info("Mail sent. to={} subject='{}'", maskAddresses(s.to), safeSubject);
            return true;
        } catch (Exception e) {
            handleFailure(s, "smtp_send_failed", e);
            return false;
        }
    }

    /** Hands the message to the SMTP transport. */
    protected void transport(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }

    static Properties smtpProperties(Settings s) {
        Properties props = new Properties();
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.host", s.host);
        props.put("mail.smtp.port", String.valueOf(s.port));
        if (s.port == 465) {
            props.put("mail.smtp.ssl.enable", "true");
        } else {
            props.put("mail.smtp.starttls.enable", "true");
        }
        return props;
    }

    private void writeDryRunArtifacts(Settings s, String subject, String textBody, String htmlBody) throws Exception {
        Files.createDirectories(s.dryRunDir);
        String stamp = STAMP.format(Instant.now());
        Path emlPath = s.dryRunDir.resolve("mail_" + stamp + ".eml");
        Path htmlPath = s.dryRunDir.resolve("mail_" + stamp + ".html");
        Path txtPath = s.dryRunDir.resolve("mail_" + stamp + ".txt");

        String eml = "From: " + safe(s.from) + "\n"
                + "To: " + (s.to == null ? "" : String.join(",", s.to)) + "\n"
                + "Subject: " + safe(subject) + "\n"
                + "MIME-Version: 1.0\n"
                + "Content-Type: text/html; charset=UTF-8\n\n"
                + safe(htmlBody);
        Files.writeString(emlPath, eml, StandardCharsets.UTF_8);
        Files.writeString(htmlPath, safe(htmlBody), StandardCharsets.UTF_8);
        Files.writeString(txtPath, safe(textBody), StandardCharsets.UTF_8);
    }

    private void handleFailure(Settings s, String stage, Exception e) throws MessagingException {
        String message = "Mail send failed stage=" + stage
                + " smtp=" + safe(s.host) + ":" + s.port
                + " from=" + maskAddress(s.from)
                + " to=" + maskAddresses(s.to)
                + " err=" + (e == null ? "" : safe(e.getMessage()));

        if (s.failFast) {
            if (e instanceof MessagingException) {
                throw (MessagingException) e;
            }
            throw new MessagingException(message, e);
        }

        LOG.error(message);
    }

    static String maskAddresses(List<String> to) {
        if (to == null || to.isEmpty()) {
            return "";
        }
        return to.stream().map(Mailer::maskAddress).collect(Collectors.joining(","));
    }

    static String maskAddress(String raw) {
        String value = safe(raw);
        int at = value.indexOf('@');
        if (at <= 0) {
            return value;
        }
        String local = value.substring(0, at);
        String domain = value.substring(at + 1);
        if (local.length() <= 1) {
            return "*@" + domain;
        }
        return local.substring(0, 1) + "***@" + domain;
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
