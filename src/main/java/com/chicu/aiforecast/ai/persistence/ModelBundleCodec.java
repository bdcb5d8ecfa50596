package com.chicu.aiforecast.ai.persistence;

import com.chicu.aiforecast.ai.ml.model.ModelBundle;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

final class ModelBundleCodec {

    private ModelBundleCodec() {
    }

    static byte[] encode(ModelBundle bundle) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(64 * 1024);
        try (ObjectOutputStream oos = new ObjectOutputStream(bos)) {
            oos.writeObject(bundle);
        } catch (IOException e) {
            throw new IllegalStateException("model bundle serialize failed version=" + bundle.getVersion(), e);
        }
        return bos.toByteArray();
    }

    static ModelBundle decode(byte[] payload, String version) {
        if (payload == null || payload.length == 0) {
            throw new IllegalStateException("model payload is empty version=" + version);
        }
        try (ObjectInputStream ois = new ObjectInputStream(new ByteArrayInputStream(payload))) {
            Object o = ois.readObject();
            if (!(o instanceof ModelBundle b)) {
                throw new IllegalStateException("payload is not a ModelBundle version=" + version
                        + " type=" + (o == null ? "null" : o.getClass().getName()));
            }
            return b;
        } catch (IOException | ClassNotFoundException e) {
            throw new IllegalStateException("model bundle deserialize failed version=" + version, e);
        }
    }
}
