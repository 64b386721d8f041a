package com.phillippitts.voicenotes.service.ratelimit;

import com.phillippitts.voicenotes.exception.ErrorKind;
import com.phillippitts.voicenotes.exception.RateLimitException;
import com.phillippitts.voicenotes.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RateLimitGateTest {

    @Test
    void admitsWhileTokensRemain() {
        RateLimiter limiter = new TokenBucketRateLimiter("gpt-4o", 1, 1.0, MutableClock.atEpoch());

        RateLimitGate.admitOrThrow(limiter, "content processing");

        assertThat(limiter.getAvailableTokens()).isZero();
    }

    @Test
    void throwsWithWaitEstimateWhenEmpty() {
        RateLimiter limiter = new TokenBucketRateLimiter("whisper", 1, 3.0 / 60.0, MutableClock.atEpoch());
        RateLimitGate.admitOrThrow(limiter, "transcription");

        RateLimitException ex = catchThrowableOfType(
                () -> RateLimitGate.admitOrThrow(limiter, "transcription"), RateLimitException.class);

        assertThat(ex.getKind()).isEqualTo(ErrorKind.RATE_LIMIT);
        assertThat(ex.getEndpoint()).isEqualTo("whisper");
        assertThat(ex.getRetryAfterMs()).isEqualTo(20_000L);
        assertThat(ex.getMessage())
                .isEqualTo("Rate limit exceeded for transcription. Please wait 20 seconds and try again.");
    }

    @Test
    void usesSingularForOneSecond() {
        assertThat(RateLimitGate.message("transcription", 400))
                .isEqualTo("Rate limit exceeded for transcription. Please wait 1 second and try again.");
    }

    @Test
    void refusalDoesNotConsumeTokens() {
        MutableClock clock = MutableClock.atEpoch();
        RateLimiter limiter = new TokenBucketRateLimiter("whisper", 1, 1.0, clock);
        RateLimitGate.admitOrThrow(limiter, "transcription");
        assertThatThrownBy(() -> RateLimitGate.admitOrThrow(limiter, "transcription"))
                .isInstanceOf(RateLimitException.class);

        clock.advanceMillis(1_000);

        RateLimitGate.admitOrThrow(limiter, "transcription");
    }
}
