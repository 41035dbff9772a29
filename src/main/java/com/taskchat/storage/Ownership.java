package com.taskchat.storage;

final class Ownership {

    private Ownership() {
    }

    static String requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner is required");
        }
        return owner;
    }

    static int clampLimit(int limit, int max) {
        if (limit <= 0) {
            return 0;
        }
        return Math.min(limit, max);
    }
}
