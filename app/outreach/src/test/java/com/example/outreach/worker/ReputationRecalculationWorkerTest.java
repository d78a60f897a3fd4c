package com.example.outreach.worker;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.outreach.service.SendingRateGovernor;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ReputationRecalculationWorkerTest {

  @Test
  void oneFailingOwnerDoesNotStopTheRest() {
    final SendingRateGovernor governor = Mockito.mock(SendingRateGovernor.class);
    when(governor.ownersInWindow()).thenReturn(List.of("owner-1", "owner-2", "owner-3"));
    when(governor.recalculateReputation("owner-2"))
        .thenThrow(new IllegalStateException("stats unavailable"));

    new ReputationRecalculationWorker(governor).run();

    verify(governor).recalculateReputation("owner-1");
    verify(governor).recalculateReputation("owner-2");
    verify(governor).recalculateReputation("owner-3");
  }
}
