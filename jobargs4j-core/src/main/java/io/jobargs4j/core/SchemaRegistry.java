package io.jobargs4j.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobargs4j.JobWorker;
import io.jobargs4j.SchemaNotDefinedException;
import io.jobargs4j.schema.Default;
import io.jobargs4j.schema.DefaultFactory;
import io.jobargs4j.schema.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Locates, validates and caches argument schemas.
 *
 * <p>A worker's schema is the {@code record} nested in the worker class under the name
 * {@code Args}. Resolution happens lazily on first use and is cached per worker class.
 * The caches are written without locking: two threads resolving the same class at once
 * both build an equal schema and the later write wins.
 */
public class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    public static final String ARGS_TYPE_NAME = "Args";

    private final ObjectMapper objectMapper;
    private final Map<Class<?>, Optional<ArgumentSchema>> schemasByWorker = new ConcurrentHashMap<>();
    private final Map<Class<?>, ArgumentSchema> schemasByRecord = new ConcurrentHashMap<>();

    public SchemaRegistry(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public SchemaRegistry() {
        this(new ObjectMapper());
    }

    /**
     * Resolve the argument schema of a worker.
     *
     * @return the schema, or empty when the worker declares no {@code Args}
     * @throws SchemaNotDefinedException if {@code Args} exists but is not a usable schema
     */
    public Optional<ArgumentSchema> resolve(JobWorker<?> worker) {
        Objects.requireNonNull(worker, "worker must not be null");
        Class<?> workerType = worker.getClass();

        Optional<ArgumentSchema> cached = schemasByWorker.get(workerType);
        if (cached != null) {
            return cached;
        }

        Optional<ArgumentSchema> resolved = resolveWorker(workerType, worker.name());
        schemasByWorker.put(workerType, resolved);
        log.debug("Resolved argument schema worker={} schema={}", worker.name(), resolved.orElse(null));
        return resolved;
    }

    /**
     * Resolve the schema of a record type directly (used for nested records).
     */
    public ArgumentSchema schemaOf(Class<? extends Record> recordType) {
        Objects.requireNonNull(recordType, "recordType must not be null");
        return resolveRecord(recordType, labelOf(recordType), new HashSet<>());
    }

    private Optional<ArgumentSchema> resolveWorker(Class<?> workerType, String workerName) {
        Class<?> argsType = findArgsType(workerType);
        Class<?> declared = declaredTypeArgument(workerType);
        String label = workerName + "." + ARGS_TYPE_NAME;

        if (argsType == null) {
            if (declared != null && declared != Void.class && declared != Object.class) {
                throw new SchemaNotDefinedException(workerName + " implements JobWorker<"
                        + declared.getSimpleName() + "> but declares no nested " + ARGS_TYPE_NAME + " record");
            }
            return Optional.empty();
        }

        if (!argsType.isRecord()) {
            throw new SchemaNotDefinedException(label + " must be a record, got " + kindOf(argsType));
        }
        if (declared == Void.class) {
            throw new SchemaNotDefinedException(workerName + " declares " + ARGS_TYPE_NAME
                    + " but implements JobWorker<Void>");
        }
        if (declared != null && declared != Object.class && declared != argsType) {
            throw new SchemaNotDefinedException(workerName + " implements JobWorker<" + declared.getSimpleName()
                    + "> but its arguments are declared by " + argsType.getName());
        }

        return Optional.of(resolveRecord(argsType, label, new HashSet<>()));
    }

    private ArgumentSchema resolveRecord(Class<?> recordType, String label, Set<Class<?>> visiting) {
        ArgumentSchema cached = schemasByRecord.get(recordType);
        if (cached != null) {
            return cached;
        }
        visiting.add(recordType);

        @SuppressWarnings("unchecked")
        Class<? extends Record> type = (Class<? extends Record>) recordType;
        RecordComponent[] components = type.getRecordComponents();
        List<ArgumentField> fields = new ArrayList<>(components.length);
        Class<?>[] parameterTypes = new Class<?>[components.length];

        for (int i = 0; i < components.length; i++) {
            RecordComponent component = components[i];
            parameterTypes[i] = component.getType();
            TypeDescriptor descriptor = describe(component.getGenericType(), component.getName(), label);
            fields.add(toField(component, descriptor, label));
        }

        Constructor<?> constructor;
        try {
            constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
        } catch (NoSuchMethodException | RuntimeException e) {
            throw new SchemaNotDefinedException("Cannot use the canonical constructor of " + label + ": " + e.getMessage(), e);
        }

        ArgumentSchema schema = new ArgumentSchema(type, fields, constructor);

        for (ArgumentField field : fields) {
            for (Class<?> nested : nestedRecords(field.type())) {
                if (!visiting.contains(nested)) {
                    resolveRecord(nested, labelOf(nested), visiting);
                }
            }
        }

        schemasByRecord.put(recordType, schema);
        return schema;
    }

    private ArgumentField toField(RecordComponent component, TypeDescriptor descriptor, String label) {
        String name = component.getName();
        boolean nullable = component.isAnnotationPresent(Nullable.class);
        if (nullable && component.getType().isPrimitive()) {
            throw new SchemaNotDefinedException("Primitive argument '" + name + "' of " + label + " cannot be @Nullable");
        }

        Default literal = component.getAnnotation(Default.class);
        DefaultFactory factory = component.getAnnotation(DefaultFactory.class);
        if (literal != null && factory != null) {
            throw new SchemaNotDefinedException("Argument '" + name + "' of " + label
                    + " declares both @Default and @DefaultFactory");
        }

        Supplier<?> defaults = null;
        if (literal != null) {
            defaults = literalDefault(literal.value(), component);
        } else if (factory != null) {
            defaults = factoryDefault(factory.value(), name, label);
        }

        if (defaults != null) {
            Object probe;
            try {
                probe = defaults.get();
            } catch (RuntimeException e) {
                throw new SchemaNotDefinedException("Invalid default for argument '" + name + "' of " + label
                        + ": " + e.getMessage(), e);
            }
            if (probe == null && !nullable) {
                throw new SchemaNotDefinedException("Default for argument '" + name + "' of " + label
                        + " is null but the argument is not @Nullable");
            }
        }

        Method accessor = component.getAccessor();
        accessor.setAccessible(true);
        return new ArgumentField(name, descriptor, nullable, defaults, accessor);
    }

    private Supplier<?> literalDefault(String text, RecordComponent component) {
        JavaType javaType = objectMapper.getTypeFactory().constructType(component.getGenericType());
        return () -> {
            try {
                return objectMapper.readValue(text, javaType);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException(e.getOriginalMessage(), e);
            }
        };
    }

    private static Supplier<?> factoryDefault(Class<? extends Supplier<?>> factoryType, String name, String label) {
        try {
            Constructor<? extends Supplier<?>> constructor = factoryType.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new SchemaNotDefinedException("Cannot create default factory " + factoryType.getName()
                    + " for argument '" + name + "' of " + label, e);
        }
    }

    private static TypeDescriptor describe(Type type, String name, String label) {
        if (type instanceof Class<?> c) {
            if (c == String.class) {
                return TypeDescriptor.scalar(TypeDescriptor.Kind.STRING, c);
            }
            if (c == int.class || c == Integer.class || c == long.class || c == Long.class) {
                return TypeDescriptor.scalar(TypeDescriptor.Kind.INTEGER, c);
            }
            if (c == double.class || c == Double.class || c == float.class || c == Float.class) {
                return TypeDescriptor.scalar(TypeDescriptor.Kind.FLOAT, c);
            }
            if (c == boolean.class || c == Boolean.class) {
                return TypeDescriptor.scalar(TypeDescriptor.Kind.BOOLEAN, c);
            }
            if (c.isEnum()) {
                return TypeDescriptor.scalar(TypeDescriptor.Kind.ENUM, c);
            }
            if (c.isRecord()) {
                return TypeDescriptor.record(c);
            }
            if (c == Object.class) {
                return TypeDescriptor.any();
            }
            if (c == List.class) {
                return TypeDescriptor.array(TypeDescriptor.any());
            }
            if (c == Map.class) {
                return TypeDescriptor.map(TypeDescriptor.scalar(TypeDescriptor.Kind.STRING, String.class), TypeDescriptor.any());
            }
        } else if (type instanceof ParameterizedType p && p.getRawType() instanceof Class<?> raw) {
            Type[] arguments = p.getActualTypeArguments();
            if (raw == List.class) {
                return TypeDescriptor.array(describe(arguments[0], name, label));
            }
            if (raw == Map.class) {
                TypeDescriptor key = describe(arguments[0], name, label);
                if (key.kind() != TypeDescriptor.Kind.STRING
                        && key.kind() != TypeDescriptor.Kind.INTEGER
                        && key.kind() != TypeDescriptor.Kind.ENUM) {
                    throw new SchemaNotDefinedException("Unsupported map key type " + arguments[0].getTypeName()
                            + " for argument '" + name + "' of " + label);
                }
                return TypeDescriptor.map(key, describe(arguments[1], name, label));
            }
        } else if (type instanceof WildcardType w && w.getLowerBounds().length == 0) {
            return describe(w.getUpperBounds()[0], name, label);
        }

        throw new SchemaNotDefinedException("Unsupported type " + type.getTypeName()
                + " for argument '" + name + "' of " + label);
    }

    private static List<Class<?>> nestedRecords(TypeDescriptor descriptor) {
        List<Class<?>> found = new ArrayList<>(2);
        collectRecords(descriptor, found);
        return found;
    }

    private static void collectRecords(TypeDescriptor descriptor, List<Class<?>> found) {
        if (descriptor == null) {
            return;
        }
        if (descriptor.kind() == TypeDescriptor.Kind.RECORD) {
            found.add(descriptor.rawType());
            return;
        }
        collectRecords(descriptor.keyType(), found);
        collectRecords(descriptor.elementType(), found);
    }

    private static Class<?> findArgsType(Class<?> workerType) {
        for (Class<?> c = workerType; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Class<?> member : c.getDeclaredClasses()) {
                if (ARGS_TYPE_NAME.equals(member.getSimpleName())) {
                    return member;
                }
            }
        }
        return null;
    }

    /**
     * Type argument of {@code JobWorker<X>} as declared by the worker class or one of its
     * superclasses; null when it is not a plain class.
     */
    private static Class<?> declaredTypeArgument(Class<?> workerType) {
        for (Class<?> c = workerType; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Type candidate : c.getGenericInterfaces()) {
                if (candidate instanceof ParameterizedType p && p.getRawType() == JobWorker.class) {
                    Type argument = p.getActualTypeArguments()[0];
                    return argument instanceof Class<?> k ? k : null;
                }
            }
        }
        return null;
    }

    private static String kindOf(Class<?> type) {
        String kind;
        if (type.isAnnotation()) {
            kind = "annotation";
        } else if (type.isInterface()) {
            kind = "interface";
        } else if (type.isEnum()) {
            kind = "enum";
        } else if (Modifier.isAbstract(type.getModifiers())) {
            kind = "abstract class";
        } else {
            kind = "class";
        }
        return kind + " " + type.getName();
    }

    private static String labelOf(Class<?> type) {
        Class<?> enclosing = type.getDeclaringClass();
        return enclosing != null ? enclosing.getSimpleName() + "." + type.getSimpleName() : type.getSimpleName();
    }
}
