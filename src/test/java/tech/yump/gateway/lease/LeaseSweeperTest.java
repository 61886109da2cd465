package tech.yump.gateway.lease;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeaseSweeperTest {

    @Mock
    private LeaseStore leaseStore;

    @InjectMocks
    private LeaseSweeper leaseSweeper;

    @Test
    void sweep_EvictsExpiredLeases() {
        when(leaseStore.evictExpired()).thenReturn(2);

        leaseSweeper.sweep();

        verify(leaseStore).evictExpired();
    }
}
