package io.github.jakubt4.meridian.dto;

public record TleFile(String filename, String content) {
}
