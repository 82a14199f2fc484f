package com.work.txqueue.service.job;

import com.work.txqueue.config.TxQueueProperties;
import com.work.txqueue.exception.TxQueueException;
import com.work.txqueue.repository.SnapshotStore;
import com.work.txqueue.service.TxQueueService;
import com.work.txqueue.support.InMemorySnapshotStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class SnapshotPersistenceJobTest {

    @Test
    public void restore_hydrates_from_store_when_present() {
        TxQueueProperties props = new TxQueueProperties();
        SnapshotStore store = new InMemorySnapshotStore();
        store.save(props.getSnapshotKey(), "{\"version\":1,\"items\":[]}");
        TxQueueService queueService = mock(TxQueueService.class);

        new SnapshotPersistenceJob(props, queueService, store).restore();

        verify(queueService, times(1)).hydrate("{\"version\":1,\"items\":[]}");
    }

    @Test
    public void restore_without_snapshot_does_nothing() {
        TxQueueService queueService = mock(TxQueueService.class);

        new SnapshotPersistenceJob(new TxQueueProperties(), queueService, new InMemorySnapshotStore()).restore();

        verify(queueService, never()).hydrate(anyString());
    }

    @Test
    public void restore_failure_does_not_block_startup() {
        TxQueueProperties props = new TxQueueProperties();
        SnapshotStore store = new InMemorySnapshotStore();
        store.save(props.getSnapshotKey(), "{broken");
        TxQueueService queueService = mock(TxQueueService.class);
        doThrow(new TxQueueException("队列快照格式错误")).when(queueService).hydrate(anyString());

        assertDoesNotThrow(() -> new SnapshotPersistenceJob(props, queueService, store).restore());
    }

    @Test
    public void save_writes_dehydrated_blob() {
        TxQueueProperties props = new TxQueueProperties();
        props.setSnapshotKey("k");
        SnapshotStore store = new InMemorySnapshotStore();
        TxQueueService queueService = mock(TxQueueService.class);
        when(queueService.dehydrate()).thenReturn("{\"version\":1,\"items\":[]}");

        new SnapshotPersistenceJob(props, queueService, store).saveOnShutdown();

        assertEquals("{\"version\":1,\"items\":[]}", store.load("k").get());
    }

    @Test
    public void gc_job_delegates_to_service() {
        TxQueueService queueService = mock(TxQueueService.class);
        when(queueService.gc()).thenReturn(3);

        new TxQueueGcJob(queueService).runOnce();

        verify(queueService, times(1)).gc();
    }
}
