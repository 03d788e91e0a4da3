package mutant.mutators;

import java.util.function.Consumer;

import mutant.ast.Node;

final class StringLiteralMutator extends Mutator {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int MAX_RANDOM_LENGTH = 8;

    StringLiteralMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        emitSelf("");
        emitNew(() -> buildSelf(randomString()));
        emitNil();
    }

    private String randomString() {
        int length = 1 + random().nextInt(MAX_RANDOM_LENGTH);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random().nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
