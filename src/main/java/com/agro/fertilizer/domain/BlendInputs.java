package com.agro.fertilizer.domain;

import com.agro.fertilizer.exception.InvalidInputException;
import com.agro.fertilizer.exception.UnknownCropException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The three normalized input tables. Lookups (crop to requirement, id to
 * product, id to field) are built once here and never re-derived.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class BlendInputs {

    private final List<Field> fields;
    private final Map<String, CropRequirement> requirements;
    private final Map<String, Product> products;

    @Getter(AccessLevel.NONE)
    private final Map<String, Field> fieldById;

    public static BlendInputs of(Collection<Field> fields,
                                 Collection<CropRequirement> requirements,
                                 Collection<Product> products) {
        if (fields == null || fields.isEmpty()) {
            throw new InvalidInputException("Fields table has no rows");
        }
        if (products == null || products.isEmpty()) {
            throw new InvalidInputException("Products table has no rows");
        }

        Map<String, CropRequirement> reqByCrop = new LinkedHashMap<>();
        for (CropRequirement r : requirements == null ? List.<CropRequirement>of() : requirements) {
            if (isBlank(r.getCrop())) {
                throw new InvalidInputException("Requirement row without crop name");
            }
            for (Nutrient n : Nutrient.values()) {
                if (r.requirement(n) < 0) {
                    throw new InvalidInputException("Crop '" + r.getCrop() + "' has negative " + n.label() + " requirement");
                }
            }
            if (reqByCrop.putIfAbsent(r.getCrop(), r) != null) {
                throw new InvalidInputException("Crop '" + r.getCrop() + "' appears twice in the requirements table");
            }
        }

        Map<String, Product> productById = new LinkedHashMap<>();
        for (Product p : products) {
            validateProduct(p);
            if (productById.putIfAbsent(p.getId(), p) != null) {
                throw new InvalidInputException("Product '" + p.getId() + "' appears twice in the products table");
            }
        }

        Map<String, Field> fieldById = new LinkedHashMap<>();
        for (Field f : fields) {
            if (isBlank(f.getId())) {
                throw new InvalidInputException("Field row without identifier");
            }
            if (!(f.getAreaHa() > 0)) {
                throw new InvalidInputException("Field '" + f.getId() + "' has non-positive area " + f.getAreaHa());
            }
            if (!reqByCrop.containsKey(f.getCrop())) {
                throw new UnknownCropException(f.getId(), f.getCrop());
            }
            if (fieldById.putIfAbsent(f.getId(), f) != null) {
                throw new InvalidInputException("Field '" + f.getId() + "' appears twice in the fields table");
            }
        }

        return new BlendInputs(
                List.copyOf(fieldById.values()),
                Collections.unmodifiableMap(reqByCrop),
                Collections.unmodifiableMap(productById),
                Collections.unmodifiableMap(fieldById));
    }

    public CropRequirement requirementFor(Field field) {
        CropRequirement r = requirements.get(field.getCrop());
        if (r == null) {
            throw new UnknownCropException(field.getId(), field.getCrop());
        }
        return r;
    }

    public Field field(String fieldId) {
        Field f = fieldById.get(fieldId);
        if (f == null) {
            throw new InvalidInputException("Unknown field '" + fieldId + "'");
        }
        return f;
    }

    public Product product(String productId) {
        Product p = products.get(productId);
        if (p == null) {
            throw new InvalidInputException("Unknown product '" + productId + "'");
        }
        return p;
    }

    private static void validateProduct(Product p) {
        if (isBlank(p.getId())) {
            throw new InvalidInputException("Product row without identifier");
        }
        for (Nutrient n : Nutrient.values()) {
            double pct = p.percent(n);
            if (pct < 0 || pct > 100) {
                throw new InvalidInputException("Product '" + p.getId() + "' has " + n.label()
                        + " content " + pct + "% outside [0, 100]");
            }
        }
        if (p.getDoseMin() < 0) {
            throw new InvalidInputException("Product '" + p.getId() + "' has negative minimum dose");
        }
        if (p.getDoseMin() > p.getDoseMax()) {
            throw new InvalidInputException("Product '" + p.getId() + "' has minimum dose " + p.getDoseMin()
                    + " above maximum dose " + p.getDoseMax());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
