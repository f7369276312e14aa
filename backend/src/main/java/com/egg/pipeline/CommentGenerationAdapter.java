package com.egg.pipeline;

import com.egg.entity.EggbookIdea;
import com.egg.entity.EggbookNotification;
import com.egg.entity.EggbookTodo;
import com.egg.exception.ExtractionException;

import java.util.List;

/**
 * Produces the daily comments (one personal, several community personas) from a day's
 * eggbook signals.
 */
public interface CommentGenerationAdapter {

    DailyComments generate(List<EggbookIdea> ideas, List<EggbookTodo> todos, List<EggbookNotification> alerts)
            throws ExtractionException;

    /**
     * @param myEggComment the personal comment, may be empty
     * @param community persona comments
     */
    record DailyComments(String myEggComment, List<CommunityComment> community) {

        public DailyComments {
            myEggComment = myEggComment == null ? "" : myEggComment.trim();
            community = community == null ? List.of() : List.copyOf(community);
        }
    }

    record CommunityComment(String eggName, String eggComment) {

        public CommunityComment {
            eggName = eggName == null ? "" : eggName.trim();
            eggComment = eggComment == null ? "" : eggComment.trim();
        }
    }
}
