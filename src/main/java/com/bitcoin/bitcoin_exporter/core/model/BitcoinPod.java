package com.bitcoin.bitcoin_exporter.core.model;

import lombok.Getter;

import java.util.Objects;

/**
 * One StatefulSet member, addressed through the headless service.
 * Hostnames look like {@code bitcoin-stack-0.bitcoin-stack.bitcoin.svc.cluster.local}.
 */
@Getter
public class BitcoinPod {
    private final int ordinal;
    private final String host;
    private final String name;

    public BitcoinPod(int ordinal, String host){
        if (ordinal < 0) {
            throw new IllegalArgumentException("Pod ordinal cannot be negative.");
        }
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("Pod host cannot be null or empty.");
        }
        this.ordinal = ordinal;
        this.host = host;
        this.name = shortName(host);
    }

    /**
     * Builds the pod hostname for the given ordinal of a headless service.
     */
    public static BitcoinPod forOrdinal(int ordinal, String serviceName, String namespace, String clusterDomain) {
        String host = String.format("%s-%d.%s.%s.%s", serviceName, ordinal, serviceName, namespace, clusterDomain);
        return new BitcoinPod(ordinal, host);
    }

    /**
     * First DNS label of the hostname.
     */
    static String shortName(String host) {
        int dot = host.indexOf('.');
        return dot < 0 ? host : host.substring(0, dot);
    }

    @Override
    public boolean equals(Object o){
        if(this == o) return  true;
        if (o == null || getClass() != o.getClass()) return false;
        BitcoinPod pod = (BitcoinPod) o;
        return ordinal == pod.ordinal && host.equals(pod.host);
    }

    @Override
    public int hashCode(){
        return Objects.hash(ordinal, host);
    }

    @Override
    public String toString(){
        return "BitcoinPod{" +
                "ordinal=" + ordinal +
                ", host='" + host + '\'' +
                '}';
    }
}
