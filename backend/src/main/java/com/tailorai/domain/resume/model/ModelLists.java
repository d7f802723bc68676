package com.tailorai.domain.resume.model;

import java.util.List;
import java.util.Objects;

/**
 * Normalization for collections deserialized from model output, where
 * {@code null} lists and {@code null} elements both occur.
 */
public final class ModelLists {

    private ModelLists() {
    }

    public static <T> List<T> nonNullElements(List<T> list) {
        if (list == null) {
            return List.of();
        }
        return list.stream().filter(Objects::nonNull).toList();
    }
}
