package net.spookly.i2ptunnel.transport;

/**
 * Receives body bytes of a streamed response after status and headers were returned.
 * Callbacks arrive on a transport I/O thread and must not block.
 */
public interface BodyConsumer {
    BodyConsumer NOOP = new BodyConsumer() {
        @Override
        public void onChunk(byte[] chunk) {
        }

        @Override
        public void onComplete() {
        }

        @Override
        public void onError(Throwable cause) {
        }
    };

    void onChunk(byte[] chunk);

    void onComplete();

    void onError(Throwable cause);
}
