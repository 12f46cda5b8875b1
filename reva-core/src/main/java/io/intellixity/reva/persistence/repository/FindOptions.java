package io.intellixity.reva.persistence.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options for the {@code find*} family.\n
 *
 * The entity manager forwards options untouched; repositories decide how to apply them.\n
 *
 * @param skip number of entities to skip (null: none)\n
 * @param take maximum number of entities (null: unbounded)\n
 * @param order property -> direction, in application order\n
 * @param relations relations to load together with the entity\n
 */
public record FindOptions(Integer skip, Integer take, Map<String, Order> order, List<String> relations) {
  public FindOptions {
    if (skip != null && skip < 0) throw new IllegalArgumentException("skip must be >= 0");
    if (take != null && take < 0) throw new IllegalArgumentException("take must be >= 0");
    order = (order == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(order));
    relations = (relations == null) ? List.of() : List.copyOf(relations);
  }

  public static FindOptions none() {
    return new FindOptions(null, null, null, null);
  }

  public FindOptions withSkip(Integer skip) {
    return new FindOptions(skip, take, order, relations);
  }

  public FindOptions withTake(Integer take) {
    return new FindOptions(skip, take, order, relations);
  }

  public FindOptions withOrder(String property, Order direction) {
    if (property == null || property.isBlank()) throw new IllegalArgumentException("property is required");
    Map<String, Order> m = new LinkedHashMap<>(order);
    m.put(property, (direction == null) ? Order.ASC : direction);
    return new FindOptions(skip, take, m, relations);
  }

  public FindOptions withRelations(List<String> relations) {
    return new FindOptions(skip, take, order, relations);
  }
}
