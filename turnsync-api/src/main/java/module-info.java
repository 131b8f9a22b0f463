/**
 * Turn synchronization API module.
 *
 * <p>Contracts and wire types for synchronizing a shared game state tree
 * through deltas grouped into turns.</p>
 */
module turnsync.api
{
    requires transitive com.fasterxml.jackson.annotation;

    exports org.abstractica.turnsync;
    exports org.abstractica.turnsync.delta;
    exports org.abstractica.turnsync.error;
    exports org.abstractica.turnsync.protocol;
    exports org.abstractica.turnsync.state;

    opens org.abstractica.turnsync.delta;
    opens org.abstractica.turnsync.protocol;
    opens org.abstractica.turnsync.state;
}
