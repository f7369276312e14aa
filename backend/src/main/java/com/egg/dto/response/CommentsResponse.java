package com.egg.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Comments split by channel: the user's own egg and the community personas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentsResponse {

    private List<CommentResponse> myEgg;

    private List<CommentResponse> community;
}
