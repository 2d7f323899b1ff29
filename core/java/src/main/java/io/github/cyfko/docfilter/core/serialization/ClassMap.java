package io.github.cyfko.docfilter.core.serialization;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Mapping between the members of a model class and the elements of its serialized document.
 * <p>
 * A class map is declared once, at model-definition time, and is read-only afterwards:
 * </p>
 * <pre>{@code
 * ClassMap<Person> personMap = ClassMap.builder(Person.class)
 *     .map("name", "Name", StringSerializer.INSTANCE, Person::getName)
 *     .map("tags", "Tags", new MapSerializer<>(DictionaryRepresentation.DOCUMENT,
 *             StringSerializer.INSTANCE, Int32Serializer.INSTANCE))
 *     .build();
 * }</pre>
 *
 * @param <T> the mapped class
 * @since 1.0.0
 */
public final class ClassMap<T> {

    private final Class<T> type;
    private final Map<String, MemberMap<T>> members;

    private ClassMap(Builder<T> builder) {
        this.type = builder.type;
        this.members = Collections.unmodifiableMap(new LinkedHashMap<>(builder.members));
    }

    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type);
    }

    public Class<T> getType() {
        return type;
    }

    /**
     * @param memberName the member name as declared on the model
     * @return the member mapping, or empty if the member is not mapped
     */
    public Optional<MemberMap<T>> getMember(String memberName) {
        return Optional.ofNullable(members.get(memberName));
    }

    /**
     * @return the mapped members, in declaration order
     */
    public Map<String, MemberMap<T>> getMembers() {
        return members;
    }

    /**
     * Mapping of one member.
     *
     * @param memberName  the member name on the model
     * @param elementName the element name in the document
     * @param serializer  the member value serializer
     * @param getter      reads the member from an instance, or {@code null} if the member is
     *                    only used for querying
     * @param <T>         the declaring class
     */
    public record MemberMap<T>(String memberName, String elementName, ValueSerializer<?> serializer,
                               Function<T, ?> getter) {

        public MemberMap {
            Objects.requireNonNull(memberName, "memberName");
            Objects.requireNonNull(elementName, "elementName");
            Objects.requireNonNull(serializer, "serializer");
        }

        public MemberSerializationInfo toSerializationInfo() {
            return new MemberSerializationInfo(elementName, serializer);
        }
    }

    /**
     * Builder for {@link ClassMap}.
     *
     * @param <T> the mapped class
     */
    public static final class Builder<T> {
        private final Class<T> type;
        private final Map<String, MemberMap<T>> members = new LinkedHashMap<>();

        private Builder(Class<T> type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder<T> map(String memberName, String elementName, ValueSerializer<?> serializer) {
            return map(memberName, elementName, serializer, null);
        }

        public Builder<T> map(String memberName, String elementName, ValueSerializer<?> serializer,
                              Function<T, ?> getter) {
            MemberMap<T> member = new MemberMap<>(memberName, elementName, serializer, getter);
            if (members.putIfAbsent(memberName, member) != null) {
                throw new IllegalArgumentException("Member [" + memberName + "] of " + type.getName() + " is already mapped.");
            }
            boolean duplicateElement = members.values().stream()
                    .filter(m -> m != member)
                    .anyMatch(m -> m.elementName().equals(elementName));
            if (duplicateElement) {
                members.remove(memberName);
                throw new IllegalArgumentException("Element name [" + elementName + "] is already used in " + type.getName() + ".");
            }
            return this;
        }

        public ClassMap<T> build() {
            return new ClassMap<>(this);
        }
    }
}
