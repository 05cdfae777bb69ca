package com.hackathon.leaderboard.repository;

import com.hackathon.leaderboard.model.ScoreRecord;
import com.hackathon.leaderboard.model.Submission;

import java.util.Collection;
import java.util.List;

/**
 * Read access to the external record store. Implementations throw
 * {@link com.hackathon.leaderboard.exception.RecordStoreException} on any failure.
 */
public interface RecordStoreRepository {
    List<Submission> findSubmissionsByCompetition(String competitionId);
    List<ScoreRecord> findScoresBySubmissionIds(Collection<String> submissionIds);
}
