package com.agentdaemon.common.spi;

import com.agentdaemon.common.model.CycleResult;
import com.agentdaemon.common.model.CycleTrigger;
import reactor.core.publisher.Mono;

/**
 * The one recurring job the daemon drives.
 *
 * <p>Never invoked concurrently with itself. A failure may be reported either as a
 * {@link CycleResult} with {@code success=false} or as an error signal; the daemon
 * treats both the same way. Skipping a tick must be safe.
 */
@FunctionalInterface
public interface UnitOfWork {

    Mono<CycleResult> runOneCycle(CycleTrigger trigger);
}
