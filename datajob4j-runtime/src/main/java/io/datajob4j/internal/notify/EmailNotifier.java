package io.datajob4j.internal.notify;

import io.datajob4j.config.DataJobProperties;
import io.datajob4j.core.DeliveryException;
import io.datajob4j.pipeline.Notifier;
import io.datajob4j.utils.CronSchedules;
import org.apache.commons.mail.Email;
import org.apache.commons.mail.EmailAttachment;
import org.apache.commons.mail.EmailException;
import org.apache.commons.mail.MultiPartEmail;
import org.apache.commons.mail.SimpleEmail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.mail.util.ByteArrayDataSource;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Delivers results and failure notices by SMTP.
 *
 * <p>Each mail is attempted {@code deliveryMaxAttempts} times with a fixed {@code deliveryRetryDelay} in between.
 * In dry-run mode nothing is sent; the mail that would have gone out is logged instead.
 */
public class EmailNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(EmailNotifier.class);

    private static final DateTimeFormatter SUBJECT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter FILE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int SMTP_TIMEOUT_MS = 30_000;

    private final DataJobProperties props;
    private final MailTransport transport;
    private final ZoneId zone;

    public EmailNotifier(DataJobProperties props) {
        this(props, MailTransport.SMTP);
    }

    public EmailNotifier(DataJobProperties props, MailTransport transport) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.zone = CronSchedules.resolveZone(props.getTimezone());
    }

    @Override
    public void deliverSuccess(String jobName, List<String> recipients, String content) throws DeliveryException {
        Objects.requireNonNull(content, "content must not be null");
        Instant now = nowInstant();
        String subject = "Job Results: " + jobName + " - " + SUBJECT_TIME.format(now.atZone(zone));
        String attachment = jobName + "_" + FILE_TIME.format(now.atZone(zone)) + ".csv";
        String body = "Job '" + jobName + "' completed successfully.\n\n"
                + "Execution time: " + SUBJECT_TIME.format(now.atZone(zone)) + " (" + zone + ")\n\n"
                + "The results are attached as " + attachment + ".\n";

        if (props.isDryRun()) {
            log.info("datajob dry run, result mail not sent job={} to={} subject={} attachment={} bytes={}",
                    jobName, recipients, subject, attachment, content.length());
            return;
        }

        send("result", jobName, recipients, () -> {
            MultiPartEmail email = new MultiPartEmail();
            configure(email, recipients, subject);
            email.setMsg(body);
            email.attach(
                    new ByteArrayDataSource(content.getBytes(StandardCharsets.UTF_8), "text/csv"),
                    attachment,
                    "Results of " + jobName,
                    EmailAttachment.ATTACHMENT
            );
            return email;
        });
    }

    @Override
    public void deliverFailure(String jobName, List<String> recipients, String message) throws DeliveryException {
        Instant now = nowInstant();
        String subject = "Job Failure: " + jobName + " - " + SUBJECT_TIME.format(now.atZone(zone));
        String body = "Job '" + jobName + "' failed.\n\n"
                + "Execution time: " + SUBJECT_TIME.format(now.atZone(zone)) + " (" + zone + ")\n\n"
                + "Error:\n" + message + "\n";

        if (props.isDryRun()) {
            log.info("datajob dry run, failure mail not sent job={} to={} subject={} error={}",
                    jobName, recipients, subject, message);
            return;
        }

        send("failure", jobName, recipients, () -> {
            SimpleEmail email = new SimpleEmail();
            configure(email, recipients, subject);
            email.setMsg(body);
            return email;
        });
    }

    private void configure(Email email, List<String> recipients, String subject) throws EmailException {
        email.setHostName(props.getMailHost());
        email.setSmtpPort(props.getMailPort());
        email.setStartTLSEnabled(props.isMailStartTls());
        email.setSocketConnectionTimeout(SMTP_TIMEOUT_MS);
        email.setSocketTimeout(SMTP_TIMEOUT_MS);
        email.setCharset(StandardCharsets.UTF_8.name());
        if (props.getMailUsername() != null && !props.getMailUsername().isBlank()) {
            email.setAuthentication(props.getMailUsername(), props.getMailPassword());
        }
        email.setFrom(sender());
        for (String to : recipients) {
            email.addTo(to);
        }
        email.setSubject(subject);
    }

    private void send(String kind, String jobName, List<String> recipients, EmailFactory factory) throws DeliveryException {
        if (recipients == null || recipients.isEmpty()) {
            throw new DeliveryException("No recipients for " + kind + " mail of job " + jobName);
        }
        if (props.getMailHost() == null || props.getMailHost().isBlank()) {
            throw new DeliveryException("SMTP host is not configured (datajob.mail-host)");
        }
        if (sender() == null) {
            throw new DeliveryException("Sender address is not configured (datajob.mail-from)");
        }

        int maxAttempts = props.getDeliveryMaxAttempts();
        EmailException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                transport.send(factory.create());
                log.info("datajob {} mail sent job={} recipients={} attempt={}", kind, jobName, recipients.size(), attempt);
                return;
            } catch (EmailException e) {
                lastError = e;
                log.warn("datajob {} mail attempt failed job={} attempt={}/{} msg={}",
                        kind, jobName, attempt, maxAttempts, describe(e));
            }

            if (attempt < maxAttempts) {
                try {
                    Thread.sleep(props.getDeliveryRetryDelay().toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new DeliveryException("Interrupted while retrying " + kind + " mail of job " + jobName, ie);
                }
            }
        }
        throw new DeliveryException("Failed to send " + kind + " mail for job " + jobName + " after "
                + maxAttempts + " attempts: " + describe(lastError), lastError);
    }

    // mail-from, else the SMTP user name
    private String sender() {
        if (props.getMailFrom() != null && !props.getMailFrom().isBlank()) {
            return props.getMailFrom();
        }
        if (props.getMailUsername() != null && !props.getMailUsername().isBlank()) {
            return props.getMailUsername();
        }
        return null;
    }

    private static String describe(Throwable e) {
        StringBuilder sb = new StringBuilder(String.valueOf(e.getMessage()));
        Throwable cause = e.getCause();
        if (cause != null && cause.getMessage() != null) {
            sb.append(" (").append(cause.getMessage()).append(')');
        }
        return sb.toString();
    }

    /**
     * Utility: current time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    @FunctionalInterface
    private interface EmailFactory {
        Email create() throws EmailException;
    }
}
