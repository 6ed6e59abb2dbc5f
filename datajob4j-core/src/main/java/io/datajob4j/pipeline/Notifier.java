package io.datajob4j.pipeline;

import io.datajob4j.core.DeliveryException;

import java.util.List;

public interface Notifier {

    /**
     * Send the formatted result as an attachment.
     */
    void deliverSuccess(String jobName, List<String> recipients, String content) throws DeliveryException;

    void deliverFailure(String jobName, List<String> recipients, String message) throws DeliveryException;
}
