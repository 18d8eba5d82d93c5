package com.trenddigest.data;

import com.trenddigest.core.Stage;
import com.trenddigest.core.StageException;

/**
 * The ranking provider rejected the request, or could not be reached or understood. Never retried.
 */
public class TopicFetchException extends StageException {
    public TopicFetchException(String message) {
        super(Stage.FETCH, message);
    }

    public TopicFetchException(String message, Throwable cause) {
        super(Stage.FETCH, message, cause);
    }
}
