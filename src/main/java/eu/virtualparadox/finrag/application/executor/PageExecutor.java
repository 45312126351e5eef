package eu.virtualparadox.finrag.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool that runs one completion call per PDF page.
 * <p>A dedicated type so it can be injected without qualifiers.</p>
 */
public class PageExecutor extends ThreadPoolTaskExecutor {
}
