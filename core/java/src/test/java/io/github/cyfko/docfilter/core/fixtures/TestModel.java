package io.github.cyfko.docfilter.core.fixtures;

import io.github.cyfko.docfilter.core.expression.Expression;
import io.github.cyfko.docfilter.core.expression.Expressions;
import io.github.cyfko.docfilter.core.expression.LambdaExpression;
import io.github.cyfko.docfilter.core.expression.ParameterExpression;
import io.github.cyfko.docfilter.core.serialization.BooleanSerializer;
import io.github.cyfko.docfilter.core.serialization.ClassMap;
import io.github.cyfko.docfilter.core.serialization.ClassMapSerializer;
import io.github.cyfko.docfilter.core.serialization.DictionaryRepresentation;
import io.github.cyfko.docfilter.core.serialization.DoubleSerializer;
import io.github.cyfko.docfilter.core.serialization.EnumSerializer;
import io.github.cyfko.docfilter.core.serialization.Int32Serializer;
import io.github.cyfko.docfilter.core.serialization.Int64Serializer;
import io.github.cyfko.docfilter.core.serialization.ListSerializer;
import io.github.cyfko.docfilter.core.serialization.MapSerializer;
import io.github.cyfko.docfilter.core.serialization.SerializerRegistry;
import io.github.cyfko.docfilter.core.serialization.StringSerializer;

import java.util.List;
import java.util.Map;

/**
 * Shared document model for translation tests.
 *
 * <pre>
 * Person
 *   name      -> "Name"      String
 *   age       -> "Age"       int
 *   balance   -> "Balance"   long
 *   rating    -> "Rating"    double
 *   active    -> "Active"    boolean
 *   status    -> "Status"    Status (by name)
 *   tags      -> "Tags"      Map&lt;String, String&gt; (representation chosen per test)
 *   scores    -> "Scores"    Map&lt;Integer, Integer&gt; stored as a document
 *   labels    -> "Labels"    List&lt;String&gt;
 *   flags     -> "Flags"     List&lt;Boolean&gt;
 *   items     -> "Items"     List&lt;Item&gt;
 *   address   -> "Address"   Address
 * </pre>
 */
public final class TestModel {

    public enum Status { ACTIVE, SUSPENDED }

    public static final class Person {
    }

    public static final class Item {
    }

    public static final class Address {
    }

    public static final ClassMap<Item> ITEM_MAP = ClassMap.builder(Item.class)
            .map("sku", "Sku", StringSerializer.INSTANCE)
            .map("qty", "Qty", Int32Serializer.INSTANCE)
            .build();

    public static final ClassMap<Address> ADDRESS_MAP = ClassMap.builder(Address.class)
            .map("city", "City", StringSerializer.INSTANCE)
            .map("zip", "Zip", StringSerializer.INSTANCE)
            .build();

    public static final ParameterExpression X = Expressions.parameter("x", Person.class);
    public static final ParameterExpression I = Expressions.parameter("i", Item.class);
    public static final ParameterExpression S = Expressions.parameter("s", String.class);

    private TestModel() {
    }

    public static MapSerializer<String, String> tagsSerializer(DictionaryRepresentation representation) {
        return new MapSerializer<>(representation, StringSerializer.INSTANCE, StringSerializer.INSTANCE);
    }

    public static ClassMap<Person> personMap(DictionaryRepresentation tagsRepresentation) {
        return ClassMap.builder(Person.class)
                .map("name", "Name", StringSerializer.INSTANCE)
                .map("age", "Age", Int32Serializer.INSTANCE)
                .map("balance", "Balance", Int64Serializer.INSTANCE)
                .map("rating", "Rating", DoubleSerializer.INSTANCE)
                .map("active", "Active", BooleanSerializer.INSTANCE)
                .map("status", "Status", new EnumSerializer<>(Status.class, EnumSerializer.Representation.STRING))
                .map("tags", "Tags", tagsSerializer(tagsRepresentation))
                .map("scores", "Scores", new MapSerializer<>(DictionaryRepresentation.DOCUMENT,
                        Int32Serializer.INSTANCE, Int32Serializer.INSTANCE))
                .map("labels", "Labels", new ListSerializer<>(StringSerializer.INSTANCE))
                .map("flags", "Flags", new ListSerializer<>(BooleanSerializer.INSTANCE))
                .map("items", "Items", new ListSerializer<>(new ClassMapSerializer<>(ITEM_MAP)))
                .map("address", "Address", new ClassMapSerializer<>(ADDRESS_MAP))
                .build();
    }

    public static SerializerRegistry registry(DictionaryRepresentation tagsRepresentation) {
        return SerializerRegistry.builder()
                .register(Person.class, new ClassMapSerializer<>(personMap(tagsRepresentation)))
                .register(Item.class, new ClassMapSerializer<>(ITEM_MAP))
                .build();
    }

    public static SerializerRegistry registry() {
        return registry(DictionaryRepresentation.DOCUMENT);
    }

    public static Expression name() {
        return Expressions.member(X, "name", String.class);
    }

    public static Expression age() {
        return Expressions.member(X, "age", int.class);
    }

    public static Expression balance() {
        return Expressions.member(X, "balance", long.class);
    }

    public static Expression rating() {
        return Expressions.member(X, "rating", double.class);
    }

    public static Expression active() {
        return Expressions.member(X, "active", boolean.class);
    }

    public static Expression status() {
        return Expressions.member(X, "status", Status.class);
    }

    public static Expression tags() {
        return Expressions.member(X, "tags", Map.class);
    }

    public static Expression scores() {
        return Expressions.member(X, "scores", Map.class);
    }

    public static Expression labels() {
        return Expressions.member(X, "labels", List.class);
    }

    public static Expression flags() {
        return Expressions.member(X, "flags", List.class);
    }

    public static Expression items() {
        return Expressions.member(X, "items", List.class);
    }

    public static Expression city() {
        return Expressions.member(Expressions.member(X, "address", Address.class), "city", String.class);
    }

    public static Expression itemQty() {
        return Expressions.member(I, "qty", int.class);
    }

    public static Expression itemSku() {
        return Expressions.member(I, "sku", String.class);
    }

    /**
     * @return {@code x -> body}
     */
    public static LambdaExpression predicate(Expression body) {
        return Expressions.lambda(body, X);
    }

    /**
     * @return {@code x.<array>.stream().<method>(element)}
     */
    public static Expression streamMatch(Expression array, String method, LambdaExpression element) {
        return Expressions.call(Expressions.call(array, "stream"), method, element);
    }
}
