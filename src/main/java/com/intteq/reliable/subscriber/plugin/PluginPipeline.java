package com.intteq.reliable.subscriber.plugin;

import java.util.List;

/**
 * Composes plugins into a single {@link PluginChain} ending in a terminal stage.
 * The chain is built once per subscription and reused for every delivery.
 */
public class PluginPipeline {

    private final List<MessagingPlugin> plugins;

    public PluginPipeline(List<MessagingPlugin> plugins) {
        this.plugins = List.copyOf(plugins);
    }

    public PluginChain build(PluginChain terminal) {
        PluginChain chain = terminal;
        for (int i = plugins.size() - 1; i >= 0; i--) {
            MessagingPlugin plugin = plugins.get(i);
            PluginChain next = chain;
            chain = (message, context, delivery) -> plugin.handle(message, context, delivery, next);
        }
        return chain;
    }

    public int size() {
        return plugins.size();
    }
}
