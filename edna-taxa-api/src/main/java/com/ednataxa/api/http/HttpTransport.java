package com.ednataxa.api.http;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Issues a single GET against a backbone API. Implementations do not retry.
 */
public interface HttpTransport {

    TransportResponse get(URI uri, Duration timeout) throws IOException, InterruptedException;
}
