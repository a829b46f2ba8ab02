package net.littleredcomputer.propsat;

import org.junit.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import static net.littleredcomputer.propsat.TokenType.*;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class TokenizerTest {

    private static List<TokenType> types(String text) {
        return StreamSupport.stream(Tokenizer.tokenize(text).spliterator(), false)
                .map(Token::type)
                .collect(Collectors.toList());
    }

    @Test
    public void operators() {
        assertThat(types("&|~()"), contains(AND, OR, NOT, OPEN_BRACKET, CLOSE_BRACKET));
    }

    @Test
    public void whitespaceSeparatesAndIsDropped() {
        assertThat(types(" \ta\n&\r\n b  "), contains(LITERAL, AND, LITERAL));
        assertThat(types(" \t "), is(empty()));
        assertThat(Tokenizer.tokenize("").isEmpty(), is(true));
    }

    @Test
    public void literalsAreMaximalMunch() {
        TokenSequence ts = Tokenizer.tokenize("mike2&Sally ~x1y2z");
        assertThat(types("mike2&Sally ~x1y2z"), contains(LITERAL, AND, LITERAL, NOT, LITERAL));
        assertThat(ts.get(0).name(), is("mike2"));
        assertThat(ts.get(2).name(), is("Sally"));
        assertThat(ts.get(4).name(), is("x1y2z"));
        assertThat(ts.get(5).isEof(), is(true));
    }

    @Test
    public void namesMustStartWithALetter() {
        TokenSequence ts = Tokenizer.tokenize("1a");
        assertThat(types("1a"), contains(UNKNOWN, LITERAL));
        assertThat(ts.get(0).text(), is("1"));
        assertThat(ts.get(1).name(), is("a"));
    }

    @Test
    public void unknownCharactersNeverFail() {
        assertThat(types("a + b_c"), contains(LITERAL, UNKNOWN, LITERAL, UNKNOWN, LITERAL));
    }

    @Test
    public void eofIsSticky() {
        Tokenizer t = new Tokenizer("a");
        assertThat(t.nextToken().name(), is("a"));
        assertThat(t.nextToken().isEof(), is(true));
        assertThat(t.nextToken().isEof(), is(true));
    }

    @Test
    public void render() {
        assertThat(Tokenizer.tokenize("~(mike&sally)&~peter").render(), is("~ ( mike & sally ) & ~ peter"));
        assertThat(Tokenizer.tokenize("a % b").render(), is("a % b"));
    }

    @Test
    public void renderThenTokenizeIsIdentity() {
        final String alphabet = "ab1&|~() \t#";
        Random r = new Random(1618);
        for (int t = 0; t < 500; ++t) {
            StringBuilder s = new StringBuilder();
            for (int i = r.nextInt(20); i > 0; --i) s.append(alphabet.charAt(r.nextInt(alphabet.length())));
            TokenSequence once = Tokenizer.tokenize(s.toString());
            assertThat(s.toString(), Tokenizer.tokenize(once.render()), is(once));
        }
    }

    @Test
    public void cursorRetreats() {
        TokenSequence.Cursor c = Tokenizer.tokenize("a )").cursor();
        assertThat(c.next().name(), is("a"));
        assertThat(c.next().isCloseBracket(), is(true));
        c.retreat();
        assertThat(c.peek().isCloseBracket(), is(true));
        assertThat(c.position(), is(1));
    }

    @Test(expected = IllegalStateException.class)
    public void cannotRetreatFromStart() {
        Tokenizer.tokenize("a").cursor().retreat();
    }

    @Test(expected = IllegalStateException.class)
    public void operatorsHaveNoName() {
        Tokenizer.tokenize("&").get(0).name();
    }
}
