package me.internalizable.quickplay.api;

/**
 * Builder implementation for refresh options.
 */
public class RefreshOptionsBuilder implements QuickplayAPI.RefreshOptions.Builder {

    private boolean diagnostics = false;
    private boolean publish = true;

    @Override
    public QuickplayAPI.RefreshOptions.Builder diagnostics(boolean diagnostics) {
        this.diagnostics = diagnostics;
        return this;
    }

    @Override
    public QuickplayAPI.RefreshOptions.Builder publish(boolean publish) {
        this.publish = publish;
        return this;
    }

    @Override
    public QuickplayAPI.RefreshOptions build() {
        return new RefreshOptionsImpl(diagnostics, publish);
    }

    private record RefreshOptionsImpl(
            boolean diagnostics,
            boolean publish
    ) implements QuickplayAPI.RefreshOptions {

        @Override
        public boolean isDiagnostics() {
            return diagnostics;
        }

        @Override
        public boolean isPublish() {
            return publish;
        }
    }
}
