package org.migrata.model;

public record TriggerInfo(String name, String table) {
}
