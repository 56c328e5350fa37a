package com.gs.ep.docknight.segmentation;

import com.gs.ep.docknight.segmentation.context.ContextualSegmentationOptions;
import com.gs.ep.docknight.segmentation.context.GroupedContextSegmentationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.function.Function;

/**
 * Loads grouping and contextual segmentation options from segmentation.properties.
 *
 * <p>键名以 {@code grouping.} 与 {@code context.} 为前缀，与参数名一一对应，例如
 * {@code grouping.verticalGapRatio=1.0}、{@code context.mergeThreshold=0.3}。</p>
 *
 * <p>无参构造器读取默认资源，容错：资源缺失或某个值非法时记录警告并使用默认值。
 * {@link #load(String)} 读取显式指定的资源，任何问题都抛出 {@link SegmentationConfigException}。</p>
 */
public class SegmentationConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(SegmentationConfig.class);

    public static final String DEFAULT_CONFIG = "segmentation.properties";

    private final String source;
    private final SpatialGroupingOptions spatialGroupingOptions;
    private final GroupedContextSegmentationOptions groupedContextOptions;

    public SegmentationConfig() {
        this(loadDefaultProperties(), DEFAULT_CONFIG, false);
    }

    private SegmentationConfig(Properties properties, String source, boolean strict) {
        this.source = source;
        PropertyReader reader = new PropertyReader(properties, source, strict);
        SpatialGroupingOptions spatial;
        GroupedContextSegmentationOptions grouped;
        try {
            spatial = readSpatialGroupingOptions(reader);
            grouped = readGroupedContextOptions(reader);
        } catch (IllegalArgumentException e) {
            if (strict) {
                throw e;
            }
            LOGGER.warn("Invalid configuration in {}: {}. Using defaults.", source, e.getMessage());
            spatial = SpatialGroupingOptions.defaults();
            grouped = GroupedContextSegmentationOptions.defaults();
        }
        this.spatialGroupingOptions = spatial;
        this.groupedContextOptions = grouped;
    }

    /**
     * 从类路径资源加载配置
     *
     * @throws SegmentationConfigException if the resource is missing, unreadable or holds an invalid value
     */
    public static SegmentationConfig load(String resource) throws SegmentationConfigException {
        Properties properties = new Properties();
        try (InputStream input = SegmentationConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new SegmentationConfigException("Configuration resource not found: " + resource);
            }
            properties.load(new InputStreamReader(input, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new SegmentationConfigException("Unable to read configuration resource " + resource, ex);
        }
        SegmentationConfig config = fromProperties(properties, resource);
        LOGGER.info("Loaded segmentation configuration from {}", resource);
        return config;
    }

    /**
     * @throws SegmentationConfigException if a value cannot be parsed or is out of range
     */
    public static SegmentationConfig fromProperties(Properties properties, String source)
            throws SegmentationConfigException {
        try {
            return new SegmentationConfig(properties, source, true);
        } catch (IllegalArgumentException ex) {
            throw new SegmentationConfigException("Invalid configuration in " + source + ": " + ex.getMessage(), ex);
        }
    }

    private static Properties loadDefaultProperties() {
        Properties properties = new Properties();
        try (InputStream input = SegmentationConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG)) {
            if (input == null) {
                LOGGER.warn("Unable to find {}. Using defaults.", DEFAULT_CONFIG);
                return properties;
            }
            properties.load(new InputStreamReader(input, StandardCharsets.UTF_8));
            LOGGER.info("Loaded segmentation configuration from {}", DEFAULT_CONFIG);
        } catch (IOException ex) {
            LOGGER.warn("Unable to read {}. Using defaults.", DEFAULT_CONFIG, ex);
            properties.clear();
        }
        return properties;
    }

    // ==================== 参数读取 ====================

    private static SpatialGroupingOptions readSpatialGroupingOptions(PropertyReader reader) {
        SpatialGroupingOptions d = SpatialGroupingOptions.defaults();
        return SpatialGroupingOptions.builder()
                .lineToleranceRatio(reader.getDouble("grouping.lineToleranceRatio", d.getLineToleranceRatio()))
                .horizontalGapRatio(reader.getDouble("grouping.horizontalGapRatio", d.getHorizontalGapRatio()))
                .verticalGapRatio(reader.getDouble("grouping.verticalGapRatio", d.getVerticalGapRatio()))
                .colorMatching(reader.getEnum("grouping.colorMatching", d.getColorMatching(),
                        ColorMatchingMode::fromValue))
                .fontSizeToleranceRatio(reader.getDouble("grouping.fontSizeToleranceRatio",
                        d.getFontSizeToleranceRatio()))
                .enableColumnSeparation(reader.getBoolean("grouping.enableColumnSeparation",
                        d.isEnableColumnSeparation()))
                .columnGapRatio(reader.getDouble("grouping.columnGapRatio", d.getColumnGapRatio()))
                .enablePageColumnDetection(reader.getBoolean("grouping.enablePageColumnDetection",
                        d.isEnablePageColumnDetection()))
                .maxPageColumns(reader.getInt("grouping.maxPageColumns", d.getMaxPageColumns()))
                .fullWidthRatio(reader.getDouble("grouping.fullWidthRatio", d.getFullWidthRatio()))
                .writingMode(reader.getEnum("grouping.writingMode", d.getWritingMode(), WritingModeOption::fromValue))
                .verticalColumnOrder(reader.getEnum("grouping.verticalColumnOrder", d.getVerticalColumnOrder(),
                        VerticalColumnOrder::fromValue))
                .inlineDirection(reader.getEnum("grouping.inlineDirection", d.getInlineDirection(),
                        InlineDirectionMode::fromValue))
                .build();
    }

    private static GroupedContextSegmentationOptions readGroupedContextOptions(PropertyReader reader) {
        ContextualSegmentationOptions d = ContextualSegmentationOptions.defaults();
        ContextualSegmentationOptions contextual = ContextualSegmentationOptions.builder()
                .windowSize(reader.getInt("context.windowSize", d.getWindowSize()))
                .mergeThreshold(reader.getDouble("context.mergeThreshold", d.getMergeThreshold()))
                .strongMergeThreshold(reader.getDouble("context.strongMergeThreshold", d.getStrongMergeThreshold()))
                .minCombinedChars(reader.getInt("context.minCombinedChars", d.getMinCombinedChars()))
                .boundaryContextChars(reader.getInt("context.boundaryContextChars", d.getBoundaryContextChars()))
                .suffixPrefixMergeRatio(reader.getDouble("context.suffixPrefixMergeRatio",
                        d.getSuffixPrefixMergeRatio()))
                .suffixPrefixMergeMinChars(reader.getInt("context.suffixPrefixMergeMinChars",
                        d.getSuffixPrefixMergeMinChars()))
                .adaptiveMergePercentile(reader.getDouble("context.adaptiveMergePercentile",
                        d.getAdaptiveMergePercentile()))
                .build();
        GroupedContextSegmentationOptions g = GroupedContextSegmentationOptions.defaults();
        return GroupedContextSegmentationOptions.builder()
                .contextual(contextual)
                .minXAxisOverlapRatio(reader.getDouble("context.minXAxisOverlapRatio", g.getMinXAxisOverlapRatio()))
                .contextParagraphEdgeCount(reader.getInt("context.contextParagraphEdgeCount",
                        g.getContextParagraphEdgeCount()))
                .build();
    }

    // ==================== 访问器 ====================

    public String getSource() {
        return source;
    }

    public SpatialGroupingOptions getSpatialGroupingOptions() {
        return spatialGroupingOptions;
    }

    public GroupedContextSegmentationOptions getGroupedContextOptions() {
        return groupedContextOptions;
    }

    public ContextualSegmentationOptions getContextualOptions() {
        return groupedContextOptions.getContextual();
    }

    public SpatialGrouping createSpatialGrouping() {
        return SpatialGrouping.create(spatialGroupingOptions);
    }

    /**
     * 单个键的读取：严格模式下非法值抛出 IllegalArgumentException，否则记录警告并返回默认值。
     */
    private static final class PropertyReader {
        private final Properties properties;
        private final String source;
        private final boolean strict;

        PropertyReader(Properties properties, String source, boolean strict) {
            this.properties = properties;
            this.source = source;
            this.strict = strict;
        }

        double getDouble(String key, double defaultValue) {
            return get(key, defaultValue, Double::parseDouble);
        }

        int getInt(String key, int defaultValue) {
            return get(key, defaultValue, Integer::parseInt);
        }

        boolean getBoolean(String key, boolean defaultValue) {
            return get(key, defaultValue, value -> {
                if ("true".equalsIgnoreCase(value)) {
                    return Boolean.TRUE;
                }
                if ("false".equalsIgnoreCase(value)) {
                    return Boolean.FALSE;
                }
                throw new IllegalArgumentException("expected true or false");
            });
        }

        <E extends Enum<E>> E getEnum(String key, E defaultValue, Function<String, E> parser) {
            return get(key, defaultValue, parser);
        }

        private <V> V get(String key, V defaultValue, Function<String, V> parser) {
            String raw = properties.getProperty(key);
            if (raw == null || raw.trim().isEmpty()) {
                return defaultValue;
            }
            try {
                return parser.apply(raw.trim());
            } catch (IllegalArgumentException ex) {
                String message = "Invalid value '" + raw + "' for " + key;
                if (strict) {
                    throw new IllegalArgumentException(message, ex);
                }
                LOGGER.warn("{} in {}. Using default {}.", message, source, defaultValue);
                return defaultValue;
            }
        }
    }
}
