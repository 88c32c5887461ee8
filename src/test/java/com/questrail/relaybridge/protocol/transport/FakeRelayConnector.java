package com.questrail.relaybridge.protocol.transport;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * FakeRelayConnector
 * -----------------------------------------------------------------------------
 * In-memory {@link RelayConnector}. {@link #open} only records the request;
 * tests drive the returned {@link FakeRelaySocket} explicitly
 * ({@code fireOpen}, {@code fireText}, {@code fireClose}, ...).
 */
public final class FakeRelayConnector implements RelayConnector {

    private final List<FakeRelaySocket> sockets = new ArrayList<>();

    @Override
    public RelaySocket open(URI uri, RelaySocketListener listener) {
        FakeRelaySocket socket = new FakeRelaySocket(uri, listener);
        sockets.add(socket);
        return socket;
    }

    public List<FakeRelaySocket> sockets() {
        return new ArrayList<>(sockets);
    }

    public FakeRelaySocket last() {
        if (sockets.isEmpty()) {
            throw new IllegalStateException("No socket opened");
        }
        return sockets.get(sockets.size() - 1);
    }

    public static final class FakeRelaySocket implements RelaySocket {
        private final URI uri;
        private final RelaySocketListener listener;
        private final List<String> sent = new ArrayList<>();
        private final List<byte[]> sentBinary = new ArrayList<>();

        private boolean open;
        private boolean closed;
        private boolean terminated;
        private int pings;
        private RuntimeException writeFailure;

        private FakeRelaySocket(URI uri, RelaySocketListener listener) {
            this.uri = uri;
            this.listener = listener;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public CompletableFuture<Void> send(String text) {
            if (writeFailure != null) {
                return CompletableFuture.failedFuture(writeFailure);
            }
            sent.add(text);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Void> sendBinary(byte[] payload) {
            if (writeFailure != null) {
                return CompletableFuture.failedFuture(writeFailure);
            }
            sentBinary.add(payload.clone());
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void ping() {
            pings++;
        }

        @Override
        public void close() {
            open = false;
            closed = true;
        }

        @Override
        public void terminate() {
            open = false;
            terminated = true;
        }

        public void fireOpen() {
            open = true;
            listener.onOpen();
        }

        public void fireText(String text) {
            listener.onText(text);
        }

        public void fireBinary(byte[] payload) {
            listener.onBinary(payload);
        }

        public void firePong() {
            listener.onPong();
        }

        public void fireClose(int code, String reason) {
            open = false;
            listener.onClose(code, reason);
        }

        public void fireError(Throwable cause) {
            listener.onError(cause);
        }

        public void failWritesWith(RuntimeException failure) {
            this.writeFailure = failure;
        }

        public URI uri() {
            return uri;
        }

        public List<String> sent() {
            return new ArrayList<>(sent);
        }

        public List<byte[]> sentBinary() {
            return new ArrayList<>(sentBinary);
        }

        public String lastSent() {
            return sent.isEmpty() ? null : sent.get(sent.size() - 1);
        }

        public int pings() {
            return pings;
        }

        public boolean wasClosed() {
            return closed;
        }

        public boolean wasTerminated() {
            return terminated;
        }
    }
}
