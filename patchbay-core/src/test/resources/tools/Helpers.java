package com.example.live;

final class Helpers {

    private Helpers() {}

    static String clamp(String value) {
        return value == null ? "" : value.strip();
    }
}
