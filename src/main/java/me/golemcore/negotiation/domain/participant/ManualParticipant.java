package me.golemcore.negotiation.domain.participant;

import me.golemcore.negotiation.domain.model.ParticipantKind;

/**
 * Participant voiced by a human operator. Waits on its {@link TurnChannel}
 * without a timeout.
 */
public class ManualParticipant implements Participant {

    private final String id;
    private final TurnChannel channel;

    public ManualParticipant(String id, TurnChannel channel) {
        this.id = id;
        this.channel = channel;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public ParticipantKind getKind() {
        return ParticipantKind.MANUAL;
    }

    @Override
    public String nextTurn(TurnContext context) throws InterruptedException {
        return channel.await();
    }

    public TurnChannel getChannel() {
        return channel;
    }
}
