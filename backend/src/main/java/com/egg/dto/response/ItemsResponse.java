package com.egg.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * List envelope: {@code {"items": [...]}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemsResponse<T> {

    private List<T> items;
}
