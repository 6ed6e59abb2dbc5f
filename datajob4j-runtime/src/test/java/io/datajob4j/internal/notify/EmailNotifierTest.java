package io.datajob4j.internal.notify;

import io.datajob4j.config.DataJobProperties;
import io.datajob4j.core.DeliveryException;
import org.apache.commons.mail.Email;
import org.apache.commons.mail.EmailException;
import org.apache.commons.mail.MultiPartEmail;
import org.apache.commons.mail.SimpleEmail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.mail.internet.InternetAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmailNotifierTest {

    private static final List<String> RECIPIENTS = List.of("a@example.com", "b@example.com");
    private static final String CSV = "region,amount\nnorth,10\n";

    private DataJobProperties props;
    private RecordingTransport transport;

    @BeforeEach
    void setUp() {
        props = new DataJobProperties();
        props.setMailHost("smtp.example.com");
        props.setMailFrom("reports@example.com");
        props.setDeliveryRetryDelay(Duration.ofMillis(20));
        props.setTimezone("Asia/Taipei");
        transport = new RecordingTransport();
    }

    private EmailNotifier notifier() {
        return new EmailNotifier(props, transport) {
            @Override
            protected Instant nowInstant() {
                return Instant.parse("2026-03-01T06:00:00Z");
            }
        };
    }

    @Test
    void resultMailShouldCarrySubjectRecipientsAndAttachment() throws Exception {
        notifier().deliverSuccess("daily", RECIPIENTS, CSV);

        assertEquals(1, transport.sent.size());
        Email email = transport.sent.get(0);
        assertInstanceOf(MultiPartEmail.class, email);
        assertEquals("Job Results: daily - 2026-03-01 14:00:00", email.getSubject());
        assertEquals("reports@example.com", email.getFromAddress().getAddress());
        assertEquals(RECIPIENTS, addresses(email.getToAddresses()));
        assertEquals("smtp.example.com", email.getHostName());
    }

    @Test
    void failureMailShouldBePlainText() throws Exception {
        notifier().deliverFailure("daily", RECIPIENTS, "Fetch failed: File not found: /tmp/x.csv");

        Email email = transport.sent.get(0);
        assertInstanceOf(SimpleEmail.class, email);
        assertEquals("Job Failure: daily - 2026-03-01 14:00:00", email.getSubject());
    }

    @Test
    void dryRunShouldNotSend() throws Exception {
        props.setDryRun(true);
        props.setMailHost(null);

        notifier().deliverSuccess("daily", RECIPIENTS, CSV);
        notifier().deliverFailure("daily", RECIPIENTS, "Transform failed: boom");

        assertEquals(0, transport.attempts);
    }

    @Test
    void transientErrorShouldBeRetried() throws Exception {
        transport.failuresLeft = 1;

        notifier().deliverSuccess("daily", RECIPIENTS, CSV);

        assertEquals(2, transport.attempts);
        assertEquals(1, transport.sent.size());
    }

    @Test
    void exhaustedAttemptsShouldRaise() {
        transport.failuresLeft = Integer.MAX_VALUE;

        long startedAt = System.nanoTime();
        DeliveryException e = assertThrows(DeliveryException.class,
                () -> notifier().deliverSuccess("daily", RECIPIENTS, CSV));
        long tookMs = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();

        assertEquals(2, transport.attempts);
        assertTrue(tookMs >= 20, "no delay between attempts");
        assertTrue(e.getMessage().startsWith("Failed to send result mail for job daily after 2 attempts: "),
                e.getMessage());
    }

    @Test
    void missingSmtpSettingsShouldFailFast() {
        props.setMailHost(" ");
        DeliveryException noHost = assertThrows(DeliveryException.class,
                () -> notifier().deliverFailure("daily", RECIPIENTS, "x"));
        assertEquals("SMTP host is not configured (datajob.mail-host)", noHost.getMessage());

        props.setMailHost("smtp.example.com");
        props.setMailFrom(null);
        DeliveryException noSender = assertThrows(DeliveryException.class,
                () -> notifier().deliverFailure("daily", RECIPIENTS, "x"));
        assertEquals("Sender address is not configured (datajob.mail-from)", noSender.getMessage());

        assertEquals(0, transport.attempts);
    }

    @Test
    void usernameShouldServeAsSenderWhenFromIsUnset() throws Exception {
        props.setMailFrom(null);
        props.setMailUsername("robot@example.com");
        props.setMailPassword("secret");

        notifier().deliverFailure("daily", RECIPIENTS, "x");

        assertEquals("robot@example.com", transport.sent.get(0).getFromAddress().getAddress());
    }

    @Test
    void noRecipientsShouldBeRejected() {
        assertThrows(DeliveryException.class, () -> notifier().deliverSuccess("daily", List.of(), CSV));
    }

    private static List<String> addresses(List<InternetAddress> list) {
        return list.stream().map(InternetAddress::getAddress).collect(Collectors.toList());
    }

    static class RecordingTransport implements MailTransport {
        final List<Email> sent = new ArrayList<>();
        int attempts;
        int failuresLeft;

        @Override
        public void send(Email email) throws EmailException {
            attempts++;
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new EmailException("Connection refused");
            }
            sent.add(email);
        }
    }
}
