package com.phillippitts.scriptorium.client;

import com.phillippitts.scriptorium.config.properties.ReservationProperties;
import com.phillippitts.scriptorium.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class KeepAliveSessionsTest {

    @Test
    void openStartsLoopAtConfiguredInterval() {
        ReservationClient client = mock(ReservationClient.class);
        TaskScheduler scheduler = mock(TaskScheduler.class);
        doReturn(mock(ScheduledFuture.class)).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        SyncExecutor releaseExecutor = new SyncExecutor();
        ReservationProperties props = new ReservationProperties();
        props.setKeepAliveInterval(Duration.ofSeconds(30));

        KeepAliveLoop loop = new KeepAliveSessions(client, scheduler, releaseExecutor, props)
                .open("42", "alice", mock(KeepAliveListener.class));

        assertThat(loop.isRunning()).isTrue();
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(30)));

        loop.stop();

        verify(client).release("42", "alice");
        assertThat(releaseExecutor.executedCount()).isEqualTo(1);
    }
}
