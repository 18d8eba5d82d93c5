package com.trenddigest.output;

import com.trenddigest.core.Stage;
import com.trenddigest.core.StageException;

/**
 * The digest could not be delivered within the attempt budget, or the message could not be built.
 */
public class DeliveryException extends StageException {
    public DeliveryException(String message) {
        super(Stage.DELIVER, message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(Stage.DELIVER, message, cause);
    }
}
