/**
 * Turn synchronization implementation module.
 *
 * <p>Provides the default implementation of the turn synchronization API.</p>
 */
module turnsync.impl
{
    requires transitive turnsync.api;
    requires org.slf4j;
    requires com.fasterxml.jackson.core;
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;

    // Export factory implementations for external use
    exports org.abstractica.turnsync.impl.session;

    // Engine building blocks, usable without a coordinator
    exports org.abstractica.turnsync.impl.path;
    exports org.abstractica.turnsync.impl.delta;
    exports org.abstractica.turnsync.impl.sequencer;
    exports org.abstractica.turnsync.impl.snapshot;
    exports org.abstractica.turnsync.impl.serialization;
}
