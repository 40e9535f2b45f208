package dev.idbroker.transport.bus;

public enum BusType {
    SYSTEM, SESSION
}
