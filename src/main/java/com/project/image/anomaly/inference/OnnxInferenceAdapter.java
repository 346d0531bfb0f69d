package com.project.image.anomaly.inference;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import com.project.image.anomaly.exceptions.ModelExecutionException;
import com.project.image.anomaly.exceptions.ModelLoadException;
import com.project.image.anomaly.exceptions.ShapeMismatchException;
import com.project.image.anomaly.processing.Tensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

/**
 * {@link InferenceAdapter} backed by an ONNX Runtime session. The session is not assumed to be
 * re-entrant: {@link #infer} and {@link #close} serialise on one lock.
 */
public class OnnxInferenceAdapter implements InferenceAdapter {
    private static final Logger log = LoggerFactory.getLogger(OnnxInferenceAdapter.class);

    private final Path modelPath;
    private final OrtEnvironment env;
    private final OrtSession session;
    private final String inputName;
    private final long[] declaredInputShape;
    private final Object lock = new Object();
    private boolean closed;

    private OnnxInferenceAdapter(Path modelPath, OrtEnvironment env, OrtSession session,
                                 String inputName, long[] declaredInputShape) {
        this.modelPath = modelPath;
        this.env = env;
        this.session = session;
        this.inputName = inputName;
        this.declaredInputShape = declaredInputShape;
    }

    public static OnnxInferenceAdapter open(Path modelPath) {
        if (modelPath == null || !Files.isRegularFile(modelPath)) {
            throw new ModelLoadException("Model file not found: " + modelPath);
        }
        OrtEnvironment env = OrtEnvironment.getEnvironment();
        OrtSession session = null;
        try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
            session = env.createSession(modelPath.toString(), options);
            if (session.getNumInputs() < 1 || session.getNumOutputs() < 1) {
                throw new ModelLoadException("Model declares no inputs or outputs: " + modelPath);
            }
            String inputName = session.getInputNames().iterator().next();
            long[] shape = null;
            NodeInfo info = session.getInputInfo().get(inputName);
            if (info != null && info.getInfo() instanceof TensorInfo) {
                shape = ((TensorInfo) info.getInfo()).getShape();
            }
            log.info("Loaded ONNX model {} (input '{}' {})", modelPath, inputName, Arrays.toString(shape));
            return new OnnxInferenceAdapter(modelPath, env, session, inputName, shape);
        } catch (OrtException e) {
            closeQuietly(session);
            throw new ModelLoadException("Cannot load ONNX model " + modelPath + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            closeQuietly(session);
            throw e;
        }
    }

    @Override
    public Tensor infer(Tensor input) {
        checkInputShape(input.shape());
        synchronized (lock) {
            if (closed) {
                throw new ModelExecutionException("Model session already closed: " + modelPath);
            }
            try (OnnxTensor tensor = OnnxTensor.createTensor(env, FloatBuffer.wrap(input.data()), input.shape());
                 OrtSession.Result result = session.run(Collections.singletonMap(inputName, tensor))) {
                OnnxValue value = result.get(0);
                if (!(value instanceof OnnxTensor)) {
                    throw new ModelExecutionException("Model output is not a tensor: " + value.getType());
                }
                return toAnomalyTensor((OnnxTensor) value, input);
            } catch (OrtException e) {
                throw new ModelExecutionException("Inference failed: " + e.getMessage(), e);
            }
        }
    }

    private void checkInputShape(long[] actual) {
        if (declaredInputShape == null) return;
        if (declaredInputShape.length != actual.length) {
            throw new ShapeMismatchException("Model expects input rank " + declaredInputShape.length
                    + " but got " + Arrays.toString(actual));
        }
        for (int i = 0; i < actual.length; i++) {
            // negative dimensions are symbolic in ONNX
            if (declaredInputShape[i] > 0 && declaredInputShape[i] != actual[i]) {
                throw new ShapeMismatchException("Model expects input " + Arrays.toString(declaredInputShape)
                        + " but got " + Arrays.toString(actual));
            }
        }
    }

    private static Tensor toAnomalyTensor(OnnxTensor output, Tensor input) {
        long height = input.dim(2), width = input.dim(3);
        FloatBuffer buffer = output.getFloatBuffer();
        if (buffer == null) {
            throw new ModelExecutionException("Model output is not a float tensor: " + output.getInfo());
        }
        if (buffer.remaining() != height * width) {
            throw new ShapeMismatchException("Model output " + Arrays.toString(output.getInfo().getShape())
                    + " does not hold a " + height + "x" + width + " anomaly map");
        }
        float[] values = new float[buffer.remaining()];
        buffer.get(values);
        return new Tensor(new long[]{1, 1, height, width}, values);
    }

    @Override
    public String description() {
        return modelPath.getFileName().toString();
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) return;
            closed = true;
            try {
                session.close();
                log.info("Closed ONNX session for {}", modelPath);
            } catch (OrtException e) {
                throw new ModelExecutionException("Failed to close model session " + modelPath, e);
            }
        }
    }

    private static void closeQuietly(OrtSession session) {
        if (session == null) return;
        try {
            session.close();
        } catch (OrtException e) {
            log.warn("Failed to release partially loaded session: {}", e.getMessage());
        }
    }
}
