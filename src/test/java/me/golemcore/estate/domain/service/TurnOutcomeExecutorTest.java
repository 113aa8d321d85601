package me.golemcore.estate.domain.service;

import me.golemcore.estate.domain.model.FanOutTag;
import me.golemcore.estate.domain.model.ReplyChannel;
import me.golemcore.estate.domain.model.Stage;
import me.golemcore.estate.domain.model.TurnOutcome;
import me.golemcore.estate.domain.model.TurnSnapshot;
import me.golemcore.estate.domain.model.message.ScopingRequest;
import me.golemcore.estate.domain.model.message.WorkerMessage;
import me.golemcore.estate.infrastructure.event.SpringEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class TurnOutcomeExecutorTest {

    private static final ReplyChannel CHANNEL = new ReplyChannel("web", "1");

    private SpringEventBus eventBus;
    private ReplySender replySender;
    private ResponseAssembler responseAssembler;
    private TurnOutcomeExecutor executor;

    @BeforeEach
    void setUp() {
        eventBus = mock(SpringEventBus.class);
        replySender = mock(ReplySender.class);
        responseAssembler = mock(ResponseAssembler.class);
        executor = new TurnOutcomeExecutor(eventBus, replySender, responseAssembler);
    }

    @Test
    void shouldSendStatusBeforeDispatching() {
        List<WorkerMessage> dispatches = List.of(
                new ScopingRequest(FanOutTag.single("web:1", 1, Stage.SCOPING), "hi"));

        executor.execute(TurnOutcome.builder()
                .replyChannel(CHANNEL)
                .statusMessage("Processing...")
                .dispatches(dispatches)
                .build());

        InOrder order = inOrder(replySender, eventBus);
        order.verify(replySender).send(CHANNEL, "Processing...", false);
        order.verify(eventBus).publishAll(dispatches);
        verify(responseAssembler, never()).deliver(any());
    }

    @Test
    void shouldSendFinalReplyAsEndOfTurn() {
        executor.execute(TurnOutcome.builder().replyChannel(CHANNEL).finalReply("What's your budget?").build());

        verify(replySender).send(CHANNEL, "What's your budget?", true);
    }

    @Test
    void shouldHandAssemblyToAssembler() {
        TurnSnapshot snapshot = TurnSnapshot.builder().sessionKey("web:1").turn(1).replyChannel(CHANNEL).build();

        executor.execute(TurnOutcome.builder().replyChannel(CHANNEL).assembly(snapshot).build());

        verify(responseAssembler).deliver(snapshot);
        verify(replySender, never()).send(any(), anyString(), anyBoolean());
    }

    @Test
    void shouldDoNothingForEmptyOutcome() {
        executor.execute(TurnOutcome.none());
        executor.execute(null);

        verifyNoInteractions(eventBus, replySender, responseAssembler);
        verify(eventBus, never()).publishAll(anyList());
    }
}
