package com.raditha.sorter.syntax.php;

import com.raditha.sorter.syntax.Capture;
import com.raditha.sorter.syntax.Language;
import com.raditha.sorter.syntax.NodeQuery;
import com.raditha.sorter.syntax.NodeTypes;
import com.raditha.sorter.syntax.SyntaxNode;
import com.raditha.sorter.syntax.SyntaxTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PhpSyntaxTreeProviderTest {

    private PhpSyntaxTreeProvider provider;

    @BeforeEach
    void setUp() {
        provider = new PhpSyntaxTreeProvider();
    }

    private static List<String> types(List<Capture> captures) {
        return captures.stream().map(c -> c.node().type()).toList();
    }

    @Test
    void testClassMembersAreClassified() {
        SyntaxTree tree = provider.parse("""
                <?php
                final class Order
                {
                    use HasEvents, Loggable {
                        Loggable::log insteadof HasEvents;
                    }
                    public const STATUS = 'open';
                    const LIMIT = 10;
                    private ?int $id = null;
                    public array $lines = ['a' => 1];
                    public function total(): int { return 0; }
                    abstract protected function check();
                }
                """);

        assertEquals(Language.PHP, tree.language());
        assertEquals(1, tree.captures(NodeQuery.SCOPES).size());
        assertEquals(List.of(
                NodeTypes.USE_DECLARATION,
                NodeTypes.CONST_DECLARATION,
                NodeTypes.CONST_DECLARATION,
                NodeTypes.PROPERTY_DECLARATION,
                NodeTypes.PROPERTY_DECLARATION), types(tree.captures(NodeQuery.SCOPE_DECLARATIONS)));

        SyntaxNode traitUse = tree.captures(NodeQuery.SCOPE_DECLARATIONS).get(0).node();
        assertEquals(3, traitUse.range().startRow());
        assertEquals(5, traitUse.range().endRow());
    }

    @Test
    void testModifiersBecomeChildren() {
        SyntaxTree tree = provider.parse("""
                <?php
                class A
                {
                    #[Assert\\Choice(choices: [1, 2], private: true)]
                    protected static ?array $x = null;
                }
                """);

        SyntaxNode property = tree.captures(NodeQuery.SCOPE_DECLARATIONS).get(0).node();
        assertEquals(NodeTypes.PROPERTY_DECLARATION, property.type());
        assertEquals("protected", property.childText(NodeTypes.VISIBILITY_MODIFIER).orElseThrow());
        assertTrue(property.childText(NodeTypes.STATIC_MODIFIER).isPresent());
        assertEquals(1, property.children().stream()
                .filter(c -> c.type().equals(NodeTypes.VISIBILITY_MODIFIER)).count());
    }

    @Test
    void testGroupUseIsOneStatement() {
        SyntaxTree tree = provider.parse("""
                <?php
                use Foo\\{Alpha, Beta as B};
                use function Foo\\helper;
                """);

        List<Capture> uses = tree.captures(NodeQuery.NAMESPACE_USES);
        assertEquals(2, uses.size());
        assertEquals("use Foo\\{Alpha, Beta as B};", uses.get(0).node().text());
        assertEquals("use function Foo\\helper;", uses.get(1).node().text());
    }

    @Test
    void testBracedNamespace() {
        SyntaxTree tree = provider.parse("""
                <?php
                namespace App {
                    use Foo\\Bar;

                    class Baz
                    {
                        public $c;
                    }
                }
                """);

        assertEquals(1, tree.captures(NodeQuery.NAMESPACE_USES).size());
        assertEquals(1, tree.captures(NodeQuery.SCOPES).size());
        assertEquals(1, tree.captures(NodeQuery.SCOPE_DECLARATIONS).size());
    }

    @Test
    void testCommentsAreSiblings() {
        SyntaxTree tree = provider.parse("""
                <?php
                class A
                {
                    // the b
                    public $b;
                }
                """);

        SyntaxNode property = tree.captures(NodeQuery.SCOPE_DECLARATIONS).get(0).node();
        SyntaxNode comment = property.prevSibling().orElseThrow();
        assertTrue(comment.isComment());
        assertEquals("// the b", comment.text());
    }

    @Test
    void testStringsAndHeredocsDoNotConfuseTheScanner() {
        SyntaxTree tree = provider.parse("""
                <?php
                class A
                {
                    public $s = "}; public $fake;";
                    public $h = <<<EOT
                    } class Nope {
                    EOT;
                    public $last;
                }
                """);

        List<Capture> declarations = tree.captures(NodeQuery.SCOPE_DECLARATIONS);
        assertEquals(3, declarations.size());
        assertEquals("public $last;", declarations.get(2).node().text());
        assertEquals(1, tree.captures(NodeQuery.SCOPES).size());
    }

    @Test
    void testTraitDeclarationIsAScope() {
        SyntaxTree tree = provider.parse("""
                <?php
                trait Loggable
                {
                    protected $logger;
                }
                interface HasName
                {
                    const NAME = 'x';
                }
                """);

        List<Capture> scopes = tree.captures(NodeQuery.SCOPES);
        assertEquals(1, scopes.size());
        assertEquals(NodeTypes.TRAIT_DECLARATION, scopes.get(0).node().type());
        assertEquals("class", scopes.get(0).name());
    }

    @Test
    void testRowWindow() {
        SyntaxTree tree = provider.parse("""
                <?php
                use A;
                use B;
                use C;
                """);

        assertEquals(2, tree.captures(NodeQuery.NAMESPACE_USES, 2, -1).size());
        assertEquals(1, tree.captures(NodeQuery.NAMESPACE_USES, 1, 1).size());
    }
}
