package com.bitcoin.bitcoin_exporter.network.discovery;

import java.net.UnknownHostException;

/**
 * Resolves a hostname, failing when DNS has no record for it.
 */
@FunctionalInterface
public interface HostnameResolver {

    void resolve(String host) throws UnknownHostException;
}
