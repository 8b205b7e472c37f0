package io.github.jakubt4.meridian.dto;

import java.util.List;

public record TleFileSetRequest(List<TleFile> files) {
}
