package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonDocument;
import org.bson.BsonValue;

import java.util.Objects;
import java.util.Optional;

/**
 * Document serializer driven by a {@link ClassMap}.
 *
 * @param <T> the serialized class
 * @since 1.0.0
 */
public final class ClassMapSerializer<T> implements DocumentSerializer<T> {

    private final ClassMap<T> classMap;

    public ClassMapSerializer(ClassMap<T> classMap) {
        this.classMap = Objects.requireNonNull(classMap, "classMap");
    }

    public ClassMap<T> getClassMap() {
        return classMap;
    }

    @Override
    public Class<T> valueType() {
        return classMap.getType();
    }

    @Override
    public Optional<MemberSerializationInfo> memberSerializationInfo(String memberName) {
        return classMap.getMember(memberName).map(ClassMap.MemberMap::toSerializationInfo);
    }

    /**
     * Serializes every member that declares a getter; members mapped for querying only are skipped.
     */
    @Override
    public BsonValue serialize(T value) {
        BsonDocument document = new BsonDocument();
        for (ClassMap.MemberMap<T> member : classMap.getMembers().values()) {
            if (member.getter() == null) {
                continue;
            }
            Object memberValue = member.getter().apply(value);
            document.put(member.elementName(), SerializationHelper.serializeValue(member.serializer(), memberValue));
        }
        return document;
    }

    @Override
    public String toString() {
        return "ClassMapSerializer<" + classMap.getType().getSimpleName() + ">";
    }
}
