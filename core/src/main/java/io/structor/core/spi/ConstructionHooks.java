package io.structor.core.spi;

import io.structor.core.model.HookResult;
import io.structor.core.model.Struct;
import java.util.Map;
import java.util.function.Function;

/**
 * Lifecycle hooks around one construction call. Carried by a
 * {@link io.structor.core.model.Schema}; implement either method or both.
 *
 * <p>
 * {@link #beforeConstruct} sees the key-normalized input before defaults and
 * field chains run, and may reshape it (merge, rename or synthesize fields).
 * With key checking off it also sees undeclared keys; whatever it returns is
 * normalized again and undeclared keys are dropped at that point.
 * {@link #afterConstruct} sees the record only when every field chain
 * succeeded, and is the place for cross-field checks.
 *
 * <p>
 * Implementations MUST be thread-safe. When the input is a list, hooks run
 * once per element.
 */
public interface ConstructionHooks {

    /** Hooks that change nothing. */
    ConstructionHooks NONE = new ConstructionHooks() {};

    /** The default before-hook: hands the input on unchanged. */
    Function<Map<String, Object>, HookResult<Map<String, Object>>> DEFAULT_BEFORE = HookResult::proceed;

    /**
     * Runs before defaulting and field conversion.
     *
     * @param input       the normalized input, keyed by canonical key; unmodifiable
     * @param defaultHook the default behaviour, for overrides that only handle
     *                    some inputs and delegate the rest
     * @return the mapping to build from, or a rejection
     */
    default HookResult<Map<String, Object>> beforeConstruct(
            Map<String, Object> input, Function<Map<String, Object>, HookResult<Map<String, Object>>> defaultHook) {
        return defaultHook.apply(input);
    }

    /**
     * Runs after all field chains succeeded.
     *
     * @param struct the fully converted record
     * @return the final record, or a rejection
     */
    default HookResult<Struct> afterConstruct(Struct struct) {
        return HookResult.proceed(struct);
    }
}
