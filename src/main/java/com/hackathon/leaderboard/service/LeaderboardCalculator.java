package com.hackathon.leaderboard.service;

import com.hackathon.leaderboard.exception.InvalidRequestException;
import com.hackathon.leaderboard.exception.LeaderboardException;
import com.hackathon.leaderboard.exception.RecordStoreException;
import com.hackathon.leaderboard.model.LeaderboardEntry;
import com.hackathon.leaderboard.model.ScoreRecord;
import com.hackathon.leaderboard.model.Submission;
import com.hackathon.leaderboard.repository.RecordStoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Derives the ranked leaderboard of a competition from the record store and keeps
 * the result for a short TTL so bursts of events do not turn into bursts of queries.
 */
@Service
public class LeaderboardCalculator {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardCalculator.class);
    
    private final RecordStoreRepository recordStoreRepository;
    private final Clock clock;
    private final Duration cacheTtl;
    
    private final Map<String, CacheEntry> cache = new HashMap<>();
    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    // Concurrent misses for one competition share a single fetch
    private final Map<String, CompletableFuture<List<LeaderboardEntry>>> inFlight = new ConcurrentHashMap<>();
    
    @Autowired
    public LeaderboardCalculator(
            RecordStoreRepository recordStoreRepository,
            Clock clock,
            @Value("${leaderboard.cache.ttl-ms:5000}") long cacheTtlMillis) {
        this.recordStoreRepository = recordStoreRepository;
        this.clock = clock;
        this.cacheTtl = Duration.ofMillis(cacheTtlMillis);
    }
    
    /**
     * Returns the ranked leaderboard for a competition, served from cache while the
     * cached copy is younger than the TTL.
     *
     * @throws InvalidRequestException if the competition ID is blank
     * @throws RecordStoreException if the submissions or scores cannot be fetched
     */
    public List<LeaderboardEntry> calculateLeaderboard(String competitionId) {
        if (competitionId == null || competitionId.trim().isEmpty()) {
            throw new InvalidRequestException("Competition ID cannot be null or empty");
        }
        
        List<LeaderboardEntry> cached = getFromCache(competitionId);
        if (cached != null) {
            logger.debug("Cache hit for competition {}", competitionId);
            return cached;
        }
        
        CompletableFuture<List<LeaderboardEntry>> computation = new CompletableFuture<>();
        CompletableFuture<List<LeaderboardEntry>> running = inFlight.putIfAbsent(competitionId, computation);
        if (running != null) {
            logger.debug("Joining in-flight computation for competition {}", competitionId);
            return awaitComputation(running);
        }
        
        try {
            List<LeaderboardEntry> rankings = getFromCache(competitionId);
            if (rankings == null) {
                logger.debug("Cache miss for competition {}, fetching from record store", competitionId);
                rankings = computeLeaderboard(competitionId);
                cacheIfCurrent(competitionId, computation, rankings);
            }
            computation.complete(rankings);
            return rankings;
        } catch (RuntimeException | Error e) {
            computation.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(competitionId, computation);
        }
    }
    
    /**
     * Drops the cached leaderboard and detaches any computation in progress, so the
     * next read always goes to the record store.
     */
    public void invalidateCache(String competitionId) {
        cacheLock.writeLock().lock();
        try {
            cache.remove(competitionId);
            inFlight.remove(competitionId);
        } finally {
            cacheLock.writeLock().unlock();
        }
    }
    
    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        cacheLock.writeLock().lock();
        try {
            int before = cache.size();
            cache.values().removeIf(entry -> entry.isExpired(now));
            return before - cache.size();
        } finally {
            cacheLock.writeLock().unlock();
        }
    }
    
    int cacheSize() {
        cacheLock.readLock().lock();
        try {
            return cache.size();
        } finally {
            cacheLock.readLock().unlock();
        }
    }
    
    private List<LeaderboardEntry> computeLeaderboard(String competitionId) {
        List<Submission> submissions = recordStoreRepository.findSubmissionsByCompetition(competitionId);
        if (submissions.isEmpty()) {
            return Collections.emptyList();
        }
        
        Map<String, Submission> submissionsById = new LinkedHashMap<>();
        submissions.forEach(submission -> submissionsById.putIfAbsent(submission.getId(), submission));
        
        List<ScoreRecord> scores = recordStoreRepository.findScoresBySubmissionIds(
            new ArrayList<>(submissionsById.keySet()));
        Map<String, ScoreTally> tallies = tallyScores(scores, submissionsById.keySet());
        
        Instant updatedAt = clock.instant();
        List<LeaderboardEntry> rankings = new ArrayList<>(submissionsById.size());
        for (Submission submission : submissionsById.values()) {
            ScoreTally tally = tallies.getOrDefault(submission.getId(), ScoreTally.EMPTY);
            rankings.add(LeaderboardEntry.builder()
                .submissionId(submission.getId())
                .teamId(submission.getTeamId())
                .teamName(submission.getTeamName())
                .trackId(submission.getTrackId())
                .trackName(submission.getTrackName())
                .title(submission.getTitle())
                .averageScore(tally.average())
                .scoreCount(tally.count)
                .updatedAt(updatedAt)
                .build());
        }
        
        // List.sort is stable: equal averages keep the record store's order
        rankings.sort(LeaderboardCalculator::compareForRanking);
        List<LeaderboardEntry> ranked = new ArrayList<>(rankings.size());
        for (int i = 0; i < rankings.size(); i++) {
            ranked.add(rankings.get(i).toBuilder().rank(i + 1).build());
        }
        
        logger.info("Computed leaderboard for competition {}: {} submissions, {} scores",
            competitionId, ranked.size(), scores.size());
        return Collections.unmodifiableList(ranked);
    }
    
    private Map<String, ScoreTally> tallyScores(List<ScoreRecord> scores, Set<String> submissionIds) {
        Map<String, ScoreTally> tallies = new HashMap<>();
        Set<String> seenScoreIds = new HashSet<>();
        for (ScoreRecord score : scores) {
            if (!submissionIds.contains(score.getSubmissionId())) {
                continue;
            }
            if (score.getId() != null && !seenScoreIds.add(score.getId())) {
                continue;
            }
            tallies.computeIfAbsent(score.getSubmissionId(), id -> new ScoreTally()).add(score.getScore());
        }
        return tallies;
    }
    
    static int compareForRanking(LeaderboardEntry a, LeaderboardEntry b) {
        if (a.isScored() != b.isScored()) {
            return a.isScored() ? -1 : 1;
        }
        return Double.compare(b.getAverageScore(), a.getAverageScore());
    }
    
    private List<LeaderboardEntry> getFromCache(String competitionId) {
        cacheLock.readLock().lock();
        try {
            CacheEntry entry = cache.get(competitionId);
            if (entry == null || entry.isExpired(clock.instant())) {
                return null;
            }
            return entry.rankings;
        } finally {
            cacheLock.readLock().unlock();
        }
    }
    
    // A computation detached by invalidateCache must not repopulate the cache
    private void cacheIfCurrent(String competitionId, CompletableFuture<List<LeaderboardEntry>> computation,
                                List<LeaderboardEntry> rankings) {
        cacheLock.writeLock().lock();
        try {
            if (inFlight.get(competitionId) == computation) {
                cache.put(competitionId, new CacheEntry(rankings, clock.instant().plus(cacheTtl)));
            }
        } finally {
            cacheLock.writeLock().unlock();
        }
    }
    
    private static List<LeaderboardEntry> awaitComputation(CompletableFuture<List<LeaderboardEntry>> computation) {
        try {
            return computation.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LeaderboardException) {
                throw (LeaderboardException) cause;
            }
            throw new RecordStoreException("Leaderboard computation failed: " + cause.getMessage(), cause);
        }
    }
    
    private static final class CacheEntry {
        private final List<LeaderboardEntry> rankings;
        private final Instant expiresAt;
        
        private CacheEntry(List<LeaderboardEntry> rankings, Instant expiresAt) {
            this.rankings = rankings;
            this.expiresAt = expiresAt;
        }
        
        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
    
    private static final class ScoreTally {
        private static final ScoreTally EMPTY = new ScoreTally();
        
        private double total;
        private int count;
        
        private void add(double score) {
            total += score;
            count++;
        }
        
        private double average() {
            return count > 0 ? total / count : 0.0;
        }
    }
}
