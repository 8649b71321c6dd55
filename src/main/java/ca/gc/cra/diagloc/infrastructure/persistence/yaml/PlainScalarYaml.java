package ca.gc.cra.diagloc.infrastructure.persistence.yaml;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * SnakeYAML loader that keeps every plain scalar as the exact text written in the document.
 *
 * <p>The default YAML 1.1 resolver turns {@code Yes} into {@code true}, {@code 0x10} into {@code 16} and
 * {@code 2024-01-01} into a date. Catalog messages, identifiers and configuration values are text, so this
 * loader registers no implicit resolvers: {@code msg: Yes} loads as the string {@code "Yes"}. Explicit tags
 * such as {@code !!int} still apply. An empty value loads as {@code ""} rather than {@code null}.</p>
 *
 * <p>{@link Yaml} instances are not thread-safe; create one per load.</p>
 *
 * @since 0.1.0
 */
public final class PlainScalarYaml {

  private PlainScalarYaml() {}

  /**
   * @return new loader resolving every untagged scalar to {@link String}
   */
  public static Yaml newLoader() {
    LoaderOptions loaderOptions = new LoaderOptions();
    DumperOptions dumperOptions = new DumperOptions();
    return new Yaml(
        new SafeConstructor(loaderOptions),
        new Representer(dumperOptions),
        dumperOptions,
        loaderOptions,
        new StringOnlyResolver());
  }

  private static final class StringOnlyResolver extends Resolver {
    @Override
    protected void addImplicitResolvers() {
      // none: untagged scalars fall back to tag:yaml.org,2002:str
    }
  }
}
