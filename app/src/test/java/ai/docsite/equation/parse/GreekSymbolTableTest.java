package ai.docsite.equation.parse;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.equation.math.FontHint;
import ai.docsite.equation.math.MathRun;
import org.junit.jupiter.api.Test;

class GreekSymbolTableTest {

    @Test
    void mapsLowercaseAndCapitalizedNamesSeparately() {
        assertThat(GreekSymbolTable.lookup("omega")).contains("ω");
        assertThat(GreekSymbolTable.lookup("Omega")).contains("Ω");
        assertThat(GreekSymbolTable.lookup("phi")).contains("φ");
        assertThat(GreekSymbolTable.lookup("Phi")).contains("Φ");
    }

    @Test
    void holdsTwentyThreeLowercaseAndTenCapitalNames() {
        assertThat(GreekSymbolTable.size()).isEqualTo(33);
    }

    @Test
    void capitalsWithLatinLookalikesAreAbsent() {
        assertThat(GreekSymbolTable.contains("Alpha")).isFalse();
        assertThat(GreekSymbolTable.contains("Beta")).isFalse();
        assertThat(GreekSymbolTable.contains("omicron")).isFalse();
    }

    @Test
    void lookupIsExact() {
        assertThat(GreekSymbolTable.lookup("alph")).isEmpty();
        assertThat(GreekSymbolTable.lookup("\\alpha")).isEmpty();
        assertThat(GreekSymbolTable.lookup(" alpha")).isEmpty();
        assertThat(GreekSymbolTable.lookup(null)).isEmpty();
    }

    @Test
    void resolveSelectsFontHint() {
        assertThat(GreekSymbolTable.resolve("alpha")).isEqualTo(new MathRun("α", FontHint.EAST_ASIAN));
        assertThat(GreekSymbolTable.resolve("d")).isEqualTo(new MathRun("d", FontHint.DEFAULT));
        assertThat(GreekSymbolTable.resolve("ref")).isEqualTo(new MathRun("ref", FontHint.DEFAULT));
    }
}
