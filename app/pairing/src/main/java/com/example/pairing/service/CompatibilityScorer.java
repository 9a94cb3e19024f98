package com.example.pairing.service;

import com.example.pairing.model.Gender;
import com.example.pairing.model.MatchScore;
import com.example.pairing.model.PoolEntry;
import com.example.pairing.model.Preferences;
import com.example.pairing.model.SkillLevel;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Scores an unordered pair of pool entries.
 *
 * <p>{@code base} rewards preference alignment: +2 for equal desired gender, +4 for equal level,
 * +1 if either gender is {@code any}, +1 if either level is {@code any}. The wait bonus is {@code
 * min(10, (waitA + waitB) / 6)} in fractional seconds. Every pair gets a finite score, so
 * preferences only decide priority, never eligibility.
 *
 * <p>The gender term compares the two desired-partner preferences with each other, not a
 * preference against the partner's own gender.
 */
@Component
public class CompatibilityScorer {

  static final int SAME_GENDER_PREFERENCE = 2;
  static final int SAME_LEVEL = 4;
  static final int ANY_GENDER = 1;
  static final int ANY_LEVEL = 1;
  static final double MAX_WAIT_BONUS = 10.0;
  static final double WAIT_BONUS_DIVISOR = 6.0;

  public MatchScore score(PoolEntry first, PoolEntry second, Instant now) {
    final int base = baseScore(first.preferences(), second.preferences());
    final double waitSeconds = waitSeconds(first, now) + waitSeconds(second, now);
    final double waitBonus = Math.min(MAX_WAIT_BONUS, waitSeconds / WAIT_BONUS_DIVISOR);
    return new MatchScore(base, waitBonus);
  }

  int baseScore(Preferences first, Preferences second) {
    int base = 0;
    if (first.desiredPartnerGender() == second.desiredPartnerGender()) {
      base += SAME_GENDER_PREFERENCE;
    }
    if (first.level() == second.level()) {
      base += SAME_LEVEL;
    }
    if (first.desiredPartnerGender() == Gender.ANY || second.desiredPartnerGender() == Gender.ANY) {
      base += ANY_GENDER;
    }
    if (first.level() == SkillLevel.ANY || second.level() == SkillLevel.ANY) {
      base += ANY_LEVEL;
    }
    return base;
  }

  private double waitSeconds(PoolEntry entry, Instant now) {
    final long millis = Duration.between(entry.enqueuedAt(), now).toMillis();
    // clock skew never yields a negative wait
    return Math.max(0L, millis) / 1000.0;
  }
}
