package dev.blogplatform.metrics;

import dev.blogplatform.repository.CommentRepository;
import dev.blogplatform.repository.PostRepository;
import dev.blogplatform.repository.UserRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
@Slf4j
public class BlogMetrics {

    private final MeterRegistry meterRegistry;
    private final UserRepository userRepository;
    private final PostRepository postRepository;
    private final CommentRepository commentRepository;

    private final AtomicLong activeUsers = new AtomicLong(0);
    private final AtomicLong publishedPosts = new AtomicLong(0);
    private final AtomicLong totalComments = new AtomicLong(0);
    private final AtomicLong pendingComments = new AtomicLong(0);

    private Counter usersRegisteredCounter;
    private Counter failedSigninCounter;
    private Counter postsCreatedCounter;
    private Counter commentsCreatedCounter;
    private Counter postViewsCounter;

    @PostConstruct
    public void init() {
        Gauge.builder("blog.users.active", activeUsers, AtomicLong::get)
                .description("Number of non-deleted users")
                .register(meterRegistry);

        Gauge.builder("blog.posts.published", publishedPosts, AtomicLong::get)
                .description("Number of published posts")
                .tag("status", "published")
                .register(meterRegistry);

        Gauge.builder("blog.comments.total", totalComments, AtomicLong::get)
                .description("Total number of comments")
                .register(meterRegistry);

        Gauge.builder("blog.comments.pending", pendingComments, AtomicLong::get)
                .description("Number of comments awaiting approval")
                .tag("status", "pending")
                .register(meterRegistry);

        usersRegisteredCounter = meterRegistry.counter("blog.users.registered");
        failedSigninCounter = meterRegistry.counter("blog.auth.signin.failed");
        postsCreatedCounter = meterRegistry.counter("blog.posts.created");
        commentsCreatedCounter = meterRegistry.counter("blog.comments.created");
        postViewsCounter = meterRegistry.counter("blog.posts.views");
    }

    @Scheduled(fixedRateString = "${scheduling.metrics-update-ms:60000}", initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void updateMetrics() {
        Mono.zip(
                userRepository.countActive().onErrorReturn(0L),
                postRepository.countPublished().onErrorReturn(0L),
                commentRepository.countActive().onErrorReturn(0L),
                commentRepository.countPending().onErrorReturn(0L)
        ).subscribe(
                tuple -> {
                    activeUsers.set(tuple.getT1());
                    publishedPosts.set(tuple.getT2());
                    totalComments.set(tuple.getT3());
                    pendingComments.set(tuple.getT4());
                },
                error -> log.warn("Failed to update metrics: {}", error.getMessage())
        );
    }

    public void incrementUserRegistered() {
        usersRegisteredCounter.increment();
    }

    public void incrementFailedSignin() {
        failedSigninCounter.increment();
    }

    public void incrementPostCreated() {
        postsCreatedCounter.increment();
    }

    public void incrementCommentCreated() {
        commentsCreatedCounter.increment();
    }

    public void incrementPostViews() {
        postViewsCounter.increment();
    }
}
