package com.agro.fertilizer.io;

import com.agro.fertilizer.config.FertilizerProperties;
import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.CropRequirement;
import com.agro.fertilizer.domain.Field;
import com.agro.fertilizer.domain.Nutrient;
import com.agro.fertilizer.domain.Product;
import com.agro.fertilizer.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link BlendInputs} from the three CSV tables.
 * <p>
 * Missing required columns are fatal. Cells that do not parse as numbers fall
 * back to defaults: price 0, minimum dose 0, maximum dose unbounded, nutrient
 * content 0, requirement 0. Field area is the exception, it must be a
 * positive number.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputLoader {

    public static final String FIELDS_TABLE = "fields";
    public static final String REQUIREMENTS_TABLE = "requirements";
    public static final String PRODUCTS_TABLE = "products";

    public static final String COL_FIELD = "potrero";
    public static final String COL_CROP = "cultivo";
    public static final String COL_AREA = "superficie_ha";
    public static final String COL_PRODUCT = "producto";
    public static final String COL_PRICE = "precio_CLP_ton";
    public static final String COL_DOSE_MIN = "dosis_min_kg_ha";
    public static final String COL_DOSE_MAX = "dosis_max_kg_ha";

    private final CsvTableReader reader;
    private final FertilizerProperties properties;

    /**
     * Loads the tables configured under {@code fertilizer.data-dir}.
     *
     * @param requirementsOverride alternate requirement table, or null for the default one
     */
    public BlendInputs loadDefault(Path requirementsOverride) {
        Path dir = Path.of(properties.getDataDir());
        Path reqs = requirementsOverride != null ? requirementsOverride : dir.resolve(properties.getRequirementsFile());
        return load(dir.resolve(properties.getFieldsFile()), reqs, dir.resolve(properties.getProductsFile()));
    }

    public BlendInputs load(Path fieldsPath, Path requirementsPath, Path productsPath) {
        BlendInputs inputs = fromTables(
                reader.read(fieldsPath, FIELDS_TABLE),
                reader.read(requirementsPath, REQUIREMENTS_TABLE),
                reader.read(productsPath, PRODUCTS_TABLE));
        log.info("Loaded {} fields, {} crops, {} products (requirements from {})",
                inputs.getFields().size(), inputs.getRequirements().size(), inputs.getProducts().size(),
                requirementsPath.getFileName());
        return inputs;
    }

    public BlendInputs fromTables(CsvTable fields, CsvTable requirements, CsvTable products) {
        return BlendInputs.of(toFields(fields), toRequirements(requirements), toProducts(products));
    }

    List<Field> toFields(CsvTable table) {
        table.requireColumns(COL_FIELD, COL_CROP, COL_AREA);
        List<Field> fields = new ArrayList<>();
        for (Map<String, String> row : table.getRows()) {
            String id = row.get(COL_FIELD);
            Double area = parseNumber(row.get(COL_AREA));
            if (area == null) {
                throw new InvalidInputException("Field '" + id + "' has non-numeric area '" + row.get(COL_AREA) + "'");
            }
            fields.add(Field.builder()
                    .id(id)
                    .crop(row.get(COL_CROP))
                    .areaHa(area)
                    .build());
        }
        return fields;
    }

    List<CropRequirement> toRequirements(CsvTable table) {
        table.requireColumns(COL_CROP,
                Nutrient.N.requirementColumn(), Nutrient.P2O5.requirementColumn(), Nutrient.K2O.requirementColumn());
        List<CropRequirement> reqs = new ArrayList<>();
        for (Map<String, String> row : table.getRows()) {
            reqs.add(CropRequirement.builder()
                    .crop(row.get(COL_CROP))
                    .nitrogenKgHa(number(table, row, Nutrient.N.requirementColumn(), 0.0))
                    .phosphateKgHa(number(table, row, Nutrient.P2O5.requirementColumn(), 0.0))
                    .potassiumKgHa(number(table, row, Nutrient.K2O.requirementColumn(), 0.0))
                    .build());
        }
        return reqs;
    }

    List<Product> toProducts(CsvTable table) {
        table.requireColumns(COL_PRODUCT,
                Nutrient.N.contentColumn(), Nutrient.P2O5.contentColumn(), Nutrient.K2O.contentColumn(),
                COL_PRICE);
        List<Product> products = new ArrayList<>();
        for (Map<String, String> row : table.getRows()) {
            products.add(Product.builder()
                    .id(row.get(COL_PRODUCT))
                    .nitrogenPct(number(table, row, Nutrient.N.contentColumn(), 0.0))
                    .phosphatePct(number(table, row, Nutrient.P2O5.contentColumn(), 0.0))
                    .potassiumPct(number(table, row, Nutrient.K2O.contentColumn(), 0.0))
                    .pricePerTonne(number(table, row, COL_PRICE, 0.0))
                    .doseMin(number(table, row, COL_DOSE_MIN, 0.0))
                    .doseMax(number(table, row, COL_DOSE_MAX, Product.UNBOUNDED_DOSE))
                    .build());
        }
        return products;
    }

    private double number(CsvTable table, Map<String, String> row, String column, double fallback) {
        String raw = row.get(column);
        Double value = parseNumber(raw);
        if (value == null) {
            if (raw != null && !raw.isEmpty()) {
                log.warn("Table {}: value '{}' in column {} is not a number, using {}", table.getName(), raw, column, fallback);
            }
            return fallback;
        }
        return value;
    }

    /**
     * Parses "12.5", "12,5" and "1 200". Returns null for blanks, garbage, NaN and infinities.
     */
    static Double parseNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.trim().replace(" ", "");
        if (s.isEmpty()) {
            return null;
        }
        if (s.indexOf(',') >= 0 && s.indexOf('.') < 0 && s.indexOf(',') == s.lastIndexOf(',')) {
            s = s.replace(',', '.');
        }
        try {
            double v = Double.parseDouble(s);
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
