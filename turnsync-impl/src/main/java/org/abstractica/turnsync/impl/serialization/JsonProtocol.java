package org.abstractica.turnsync.impl.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.abstractica.turnsync.Protocol;
import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.Snapshot;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.error.ErrorCode;
import org.abstractica.turnsync.error.TurnSyncException;
import org.abstractica.turnsync.protocol.ClientMessage;
import org.abstractica.turnsync.protocol.MessageTypes;
import org.abstractica.turnsync.protocol.ServerMessage;
import org.abstractica.turnsync.state.StateValue;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * JSON implementation of the {@link Protocol}.
 *
 * <p>Scans the {@link ClientMessage} and {@link ServerMessage} sealed
 * hierarchies, including sealed types reached through record components
 * such as the game events, registers each record under its upper snake case
 * type name and computes a protocol hash from the record structure.</p>
 */
public final class JsonProtocol implements Protocol
{
    private final ObjectMapper mapper;
    private final String hash;
    private final Map<String, Class<? extends Record>> typesByName;

    private JsonProtocol(ObjectMapper mapper, String hash, Map<String, Class<? extends Record>> typesByName)
    {
        this.mapper = mapper;
        this.hash = hash;
        this.typesByName = Map.copyOf(typesByName);
    }

    /**
     * Creates the protocol.
     *
     * @return a new protocol instance
     * @throws IllegalArgumentException if a message type uses an unsupported component type
     */
    public static JsonProtocol create()
    {
        List<Class<? extends Record>> clientTypes = new Scanner().scan(ClientMessage.class);
        List<Class<? extends Record>> serverTypes = new Scanner().scan(ServerMessage.class);

        Map<String, Class<? extends Record>> typesByName = new HashMap<>();
        List<NamedType> namedTypes = new ArrayList<>();
        for (List<Class<? extends Record>> types : List.of(clientTypes, serverTypes))
        {
            for (Class<? extends Record> type : types)
            {
                String name = MessageTypes.typeName(type);
                Class<? extends Record> previous = typesByName.put(name, type);
                if (previous != null && previous != type)
                {
                    throw new IllegalArgumentException("Duplicate message type name " + name
                            + ": " + previous.getName() + " and " + type.getName());
                }
                namedTypes.add(new NamedType(type, name));
            }
        }

        ObjectMapper mapper = newMapper();
        mapper.registerSubtypes(namedTypes.toArray(new NamedType[0]));

        return new JsonProtocol(mapper, computeHash(clientTypes, serverTypes), typesByName);
    }

    /**
     * Creates a mapper configured for wire documents, without message subtypes.
     *
     * @return a new mapper
     */
    public static ObjectMapper newMapper()
    {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(new StateValueModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                .build();
    }

    @Override
    public String getHash()
    {
        return hash;
    }

    @Override
    public String getChecksumAlgorithm()
    {
        return StateChecksum.ALGORITHM;
    }

    /**
     * Returns the record class registered under a wire type name.
     *
     * @param typeName the type name, for example {@code GET_STATE_AT_TURN}
     * @return the record class
     * @throws IllegalArgumentException if the name is not registered
     */
    public Class<? extends Record> getMessageClass(String typeName)
    {
        Class<? extends Record> type = typesByName.get(typeName);
        if (type == null)
        {
            throw new IllegalArgumentException("Unknown message type: " + typeName);
        }
        return type;
    }

    // ========== Encoding ==========

    @Override
    public String encode(ServerMessage message)
    {
        return write(ServerMessage.class, message);
    }

    @Override
    public String encode(ClientMessage message)
    {
        return write(ClientMessage.class, message);
    }

    @Override
    public String encodeBatch(TurnDeltas batch)
    {
        return write(TurnDeltas.class, batch);
    }

    @Override
    public String encodeSnapshot(Snapshot snapshot)
    {
        return write(Snapshot.class, snapshot);
    }

    @Override
    public String encodeDelta(Delta delta)
    {
        return write(Delta.class, delta);
    }

    // ========== Decoding ==========

    @Override
    public ClientMessage decodeClientMessage(String json)
    {
        return read(ClientMessage.class, json);
    }

    @Override
    public ServerMessage decodeServerMessage(String json)
    {
        return read(ServerMessage.class, json);
    }

    @Override
    public TurnDeltas decodeBatch(String json)
    {
        return read(TurnDeltas.class, json);
    }

    @Override
    public Snapshot decodeSnapshot(String json)
    {
        return read(Snapshot.class, json);
    }

    @Override
    public Delta decodeDelta(String json)
    {
        return read(Delta.class, json);
    }

    private <T> String write(Class<T> type, T value)
    {
        Objects.requireNonNull(value, "value");
        try
        {
            return mapper.writerFor(type).writeValueAsString(value);
        }
        catch (JsonProcessingException e)
        {
            throw new TurnSyncException(ErrorCode.INTERNAL_ERROR,
                    "Failed to encode " + value.getClass().getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(Class<T> type, String json)
    {
        Objects.requireNonNull(json, "json");
        try
        {
            return mapper.readValue(json, type);
        }
        catch (JsonProcessingException e)
        {
            throw new TurnSyncException(ErrorCode.INVALID_MESSAGE,
                    "Malformed " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    // ========== Hash ==========

    private static String computeHash(List<Class<? extends Record>> clientTypes,
                                      List<Class<? extends Record>> serverTypes)
    {
        try
        {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (Class<? extends Record> type : clientTypes)
            {
                appendTypeToDigest(digest, type);
            }
            for (Class<? extends Record> type : serverTypes)
            {
                appendTypeToDigest(digest, type);
            }
            digest.update(StateChecksum.ALGORITHM.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        }
        catch (NoSuchAlgorithmException e)
        {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void appendTypeToDigest(MessageDigest digest, Class<? extends Record> type)
    {
        digest.update(MessageTypes.typeName(type).getBytes(StandardCharsets.UTF_8));
        for (RecordComponent component : type.getRecordComponents())
        {
            digest.update(component.getName().getBytes(StandardCharsets.UTF_8));
            digest.update(describe(component.getGenericType()).getBytes(StandardCharsets.UTF_8));
        }
    }

    private static String describe(Type type)
    {
        if (type instanceof ParameterizedType pt)
        {
            return describe(pt.getRawType()) + "<" + describe(pt.getActualTypeArguments()[0]) + ">";
        }
        Class<?> raw = (Class<?>) type;
        if (raw.isPrimitive())
        {
            return raw.getName();
        }
        return raw.getSimpleName();
    }

    // ========== Scanning ==========

    /**
     * Collects the records of a sealed hierarchy and of every sealed type their components use.
     */
    private static final class Scanner
    {
        private final Set<Class<?>> visitedInterfaces = new LinkedHashSet<>();
        private final Set<Class<? extends Record>> visitedRecords = new LinkedHashSet<>();
        private final List<Class<? extends Record>> messageTypes = new ArrayList<>();

        List<Class<? extends Record>> scan(Class<?> root)
        {
            if (!root.isInterface() || !root.isSealed())
            {
                throw new IllegalArgumentException("Not a sealed interface: " + root.getName());
            }
            collect(root);
            messageTypes.sort(Comparator.comparing(Class::getName));
            return messageTypes;
        }

        @SuppressWarnings("unchecked")
        private void collect(Class<?> sealedInterface)
        {
            if (!visitedInterfaces.add(sealedInterface))
            {
                return;
            }
            for (Class<?> subclass : sealedInterface.getPermittedSubclasses())
            {
                if (subclass.isRecord())
                {
                    messageTypes.add((Class<? extends Record>) subclass);
                    validateRecord((Class<? extends Record>) subclass);
                }
                else if (subclass.isInterface() && subclass.isSealed())
                {
                    collect(subclass);
                }
                else
                {
                    throw new IllegalArgumentException(
                            "Permitted type must be a record or sealed interface: " + subclass.getName());
                }
            }
        }

        private void validateRecord(Class<? extends Record> recordClass)
        {
            if (!visitedRecords.add(recordClass))
            {
                return;
            }
            for (RecordComponent component : recordClass.getRecordComponents())
            {
                validateComponent(component.getGenericType(), recordClass.getName() + "." + component.getName());
            }
        }

        @SuppressWarnings("unchecked")
        private void validateComponent(Type type, String context)
        {
            if (type instanceof ParameterizedType pt)
            {
                if (pt.getRawType() != List.class)
                {
                    throw new IllegalArgumentException("Unsupported generic type in " + context + ": " + type);
                }
                validateComponent(pt.getActualTypeArguments()[0], context + " (list element)");
                return;
            }
            if (!(type instanceof Class<?> raw))
            {
                throw new IllegalArgumentException("Unsupported type in " + context + ": " + type);
            }
            if (raw.isPrimitive() || raw == String.class || raw == UUID.class || raw == Instant.class
                    || raw == Long.class || raw == Integer.class || raw == Boolean.class
                    || raw.isEnum() || raw == StateValue.class)
            {
                return;
            }
            if (raw.isRecord())
            {
                validateRecord((Class<? extends Record>) raw);
                return;
            }
            if (raw.isInterface() && raw.isSealed())
            {
                collect(raw);
                return;
            }
            throw new IllegalArgumentException("Unsupported type in " + context + ": " + raw.getName());
        }
    }
}
