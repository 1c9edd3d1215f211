package im.arun.promptelide.tokenizer;

import lombok.Value;

import java.util.List;

/**
 * A piece of text cut to a token count, with the tokens it consists of.
 */
@Value
public class TokenSlice {
    String text;
    List<Integer> tokens;
}
