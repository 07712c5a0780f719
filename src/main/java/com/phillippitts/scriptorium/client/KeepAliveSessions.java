package com.phillippitts.scriptorium.client;

import com.phillippitts.scriptorium.config.properties.ReservationProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Opens {@link KeepAliveLoop}s wired to the shared keep-alive scheduler and release executor.
 */
@Component
public class KeepAliveSessions {

    private final ReservationClient client;
    private final TaskScheduler scheduler;
    private final Executor releaseExecutor;
    private final ReservationProperties props;

    public KeepAliveSessions(ReservationClient client,
                             @Qualifier("keepAliveScheduler") TaskScheduler scheduler,
                             @Qualifier("releaseExecutor") Executor releaseExecutor,
                             ReservationProperties props) {
        this.client = client;
        this.scheduler = scheduler;
        this.releaseExecutor = releaseExecutor;
        this.props = props;
    }

    /**
     * Starts renewing {@code holder}'s reservation on the asset. The caller must {@link KeepAliveLoop#stop()}
     * the returned loop when the editing session ends.
     */
    public KeepAliveLoop open(String assetId, String holder, KeepAliveListener listener) {
        KeepAliveLoop loop = new KeepAliveLoop(client, assetId, holder, listener,
                scheduler, releaseExecutor, props.getKeepAliveInterval());
        loop.start();
        return loop;
    }
}
