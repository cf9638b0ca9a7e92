package com.invoicebot.mail.service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Name resolution used by the link download guard. Swapped for a fixed table
 * in tests.
 */
public interface HostResolver {

    List<InetAddress> resolve(String host) throws UnknownHostException;
}
