package com.trenddigest.output;

import jakarta.mail.NoSuchProviderException;
import jakarta.mail.Session;
import jakarta.mail.Transport;

/**
 * Creates an unconnected transport for one delivery attempt.
 */
@FunctionalInterface
public interface MailTransportFactory {
    MailTransportFactory SESSION = Session::getTransport;

    Transport open(Session session, String protocol) throws NoSuchProviderException;
}
