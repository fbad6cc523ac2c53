package mail.digest.app.model;

import lombok.Value;

import java.util.List;

/**
 * One transport message: markup text plus the controls for exactly the items it contains.
 */
@Value
public class RenderedBlock {
    String text;
    List<Integer> itemIndexes;
    List<ActionControl> controls;
}
