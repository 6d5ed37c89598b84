package me.internalizable.orchestra.hub.support;

import me.internalizable.orchestra.api.hub.adapter.AdapterResult;
import me.internalizable.orchestra.api.hub.adapter.ProbeResult;
import me.internalizable.orchestra.api.hub.adapter.ServerAdapter;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scriptable adapter. Each operation can be given a result and optionally
 * held on a gate until the test releases it.
 */
public final class FakeAdapter implements ServerAdapter {

    public final AtomicInteger startCalls = new AtomicInteger();
    public final AtomicInteger stopCalls = new AtomicInteger();
    public final AtomicInteger forceStopCalls = new AtomicInteger();
    public final AtomicInteger probeCalls = new AtomicInteger();

    private volatile Supplier<AdapterResult> onStart = AdapterResult::ok;
    private volatile Supplier<AdapterResult> onStop = AdapterResult::ok;
    private volatile Supplier<AdapterResult> onForceStop = AdapterResult::ok;
    private volatile Supplier<ProbeResult> onProbe = ProbeResult::alive;

    private volatile CountDownLatch startGate;
    private volatile CountDownLatch stopGate;
    private volatile CountDownLatch probeGate;

    public final CountDownLatch startEntered = new CountDownLatch(1);
    public final CountDownLatch stopEntered = new CountDownLatch(1);

    public FakeAdapter onStart(Supplier<AdapterResult> onStart) {
        this.onStart = onStart;
        return this;
    }

    public FakeAdapter onStop(Supplier<AdapterResult> onStop) {
        this.onStop = onStop;
        return this;
    }

    public FakeAdapter onForceStop(Supplier<AdapterResult> onForceStop) {
        this.onForceStop = onForceStop;
        return this;
    }

    public FakeAdapter onProbe(Supplier<ProbeResult> onProbe) {
        this.onProbe = onProbe;
        return this;
    }

    public FakeAdapter holdStart() {
        startGate = new CountDownLatch(1);
        return this;
    }

    public FakeAdapter holdStop() {
        stopGate = new CountDownLatch(1);
        return this;
    }

    public FakeAdapter holdProbe() {
        probeGate = new CountDownLatch(1);
        return this;
    }

    public void releaseStart() {
        startGate.countDown();
    }

    public void releaseStop() {
        stopGate.countDown();
    }

    public void releaseProbe() {
        probeGate.countDown();
    }

    @Override
    public AdapterResult doStart() {
        startCalls.incrementAndGet();
        startEntered.countDown();
        await(startGate);
        return onStart.get();
    }

    @Override
    public AdapterResult doStop() {
        stopCalls.incrementAndGet();
        stopEntered.countDown();
        await(stopGate);
        return onStop.get();
    }

    @Override
    public AdapterResult forceStop() {
        forceStopCalls.incrementAndGet();
        return onForceStop.get();
    }

    @Override
    public ProbeResult probe(Duration timeout) {
        probeCalls.incrementAndGet();
        await(probeGate);
        return onProbe.get();
    }

    private static void await(CountDownLatch gate) {
        if (gate == null) {
            return;
        }
        try {
            gate.await(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
