package io.datajob4j.internal.notify;

import org.apache.commons.mail.Email;
import org.apache.commons.mail.EmailException;

/**
 * Sends a fully built mail. The default is {@link Email#send()}; tests substitute a recorder.
 */
@FunctionalInterface
public interface MailTransport {

    MailTransport SMTP = Email::send;

    void send(Email email) throws EmailException;
}
