package com.apex.decisioncore.health;

public interface BrokerConnectivityProbe {

    boolean isConnected();
}
