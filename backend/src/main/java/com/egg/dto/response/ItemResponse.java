package com.egg.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single-item envelope: {@code {"item": ...}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemResponse<T> {

    private T item;
}
