package com.raditha.sorter.syntax;

import com.raditha.sorter.syntax.java.JavaSyntaxTreeProvider;
import com.raditha.sorter.syntax.php.PhpSyntaxTreeProvider;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of syntax tree providers keyed by language.
 */
public class SyntaxTreeProviders {

    private final Map<Language, SyntaxTreeProvider> providers = new EnumMap<>(Language.class);

    /**
     * Registry holding the bundled PHP and Java providers.
     */
    public static SyntaxTreeProviders standard() {
        return new SyntaxTreeProviders()
                .register(new PhpSyntaxTreeProvider())
                .register(new JavaSyntaxTreeProvider());
    }

    public SyntaxTreeProviders register(SyntaxTreeProvider provider) {
        providers.put(provider.language(), provider);
        return this;
    }

    public Optional<SyntaxTreeProvider> forLanguage(Language language) {
        return Optional.ofNullable(providers.get(language));
    }
}
