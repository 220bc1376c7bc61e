package com.codefactory.guard.semantic;

public record RiskyPair(String first, String second) {

    public String label() {
        return first + "+" + second;
    }
}
