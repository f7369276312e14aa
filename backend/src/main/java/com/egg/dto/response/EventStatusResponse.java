package com.egg.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventStatusResponse {

    /** pending, transcribing, processed or failed */
    private String status;
}
