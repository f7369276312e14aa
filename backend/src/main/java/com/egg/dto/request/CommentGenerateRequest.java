package com.egg.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommentGenerateRequest {

    /** Defaults to today (UTC). */
    private LocalDate date;
}
