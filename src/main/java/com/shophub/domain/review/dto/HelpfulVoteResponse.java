package com.shophub.domain.review.dto;

/**
 * "도움이 돼요" 결과.
 *
 * @param newVote 이번 요청으로 투표가 새로 생성되었는지. 이미 투표한 경우 false이며 카운트는 변하지 않는다.
 */
public record HelpfulVoteResponse(Long reviewId, int helpfulCount, boolean newVote) {
}
