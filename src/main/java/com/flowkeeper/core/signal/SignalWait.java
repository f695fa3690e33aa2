package com.flowkeeper.core.signal;

import com.flowkeeper.core.substrate.DurableContext;
import com.flowkeeper.core.substrate.SignalChannel;

import java.time.Duration;

/**
 * One-shot wait for an external value on a durable signal channel.
 * <p>
 * Starts {@link State#WAITING}; {@link #await} moves it to {@link State#RECEIVED}
 * or {@link State#TIMED_OUT}, both terminal. Deliveries that arrive before the
 * wait consumes them overwrite each other, so the latest value wins. Use a new
 * instance for every wait.
 */
public final class SignalWait<T> {

    public enum State {
        WAITING,
        RECEIVED,
        TIMED_OUT
    }

    private final DurableContext ctx;
    private final SignalChannel<T> channel;
    private State state = State.WAITING;
    private T value;

    public SignalWait(DurableContext ctx, SignalChannel<T> channel) {
        this.ctx = ctx;
        this.channel = channel;
    }

    public static <T> SignalWait<T> on(DurableContext ctx, String signalName, Class<T> payloadType) {
        return new SignalWait<>(ctx, ctx.signalChannel(signalName, payloadType));
    }

    public State state() {
        return state;
    }

    /** Non-blocking; does not consume the pending value. */
    public boolean hasReceived() {
        return state == State.RECEIVED || (state == State.WAITING && channel.hasPending());
    }

    public WaitResult<T> await(Duration timeout) {
        switch (state) {
            case RECEIVED:
                return WaitResult.received(value);
            case TIMED_OUT:
                return WaitResult.timeout();
            default:
                break;
        }
        if (ctx.await(timeout, channel::hasPending)) {
            value = channel.consume();
            state = State.RECEIVED;
            return WaitResult.received(value);
        }
        state = State.TIMED_OUT;
        return WaitResult.timeout();
    }
}
