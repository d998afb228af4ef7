/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.chaincraft.transport.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.bytes.ByteArrayDecoder;
import io.netty.handler.codec.bytes.ByteArrayEncoder;
import io.netty.util.AttributeKey;
import org.apache.log4j.Logger;
import org.chaincraft.PeerId;
import org.chaincraft.manager.NodeModel;
import org.chaincraft.transport.AbstractTransportManager;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * TCP transport. Frames are prefixed with a four byte length. The first frame each side sends is
 * a hello carrying its id and listen address, separated by a newline; nothing else is delivered
 * before both hellos went through.
 * <p>
 * When two nodes dial each other at the same time both ends keep the channel opened by the node
 * with the smaller id and close the other one.
 */
public class NettyTransportManager extends AbstractTransportManager {

  public static final Logger LOGGER = Logger.getLogger(NettyTransportManager.class);

  private static final AttributeKey<Boolean> CLOSING = AttributeKey.valueOf("chaincraft.closing");

  private final PeerId me;
  private final URI address;
  private final int maxFrameSize;
  private final long connectTimeout;
  private final EventLoopGroup bossGroup;
  private final EventLoopGroup workerGroup;
  private final ConcurrentHashMap<PeerId, Channel> channels = new ConcurrentHashMap<>();
  private volatile Channel serverChannel;
  private volatile boolean running;

  public NettyTransportManager(NodeModel model) {
    this.me = model.getMyself();
    this.address = model.getMyAddress();
    this.maxFrameSize = model.getSettings().getMaxFrameSize();
    this.connectTimeout = model.getSettings().getConnectTimeout();
    bossGroup = new NioEventLoopGroup(1);
    workerGroup = new NioEventLoopGroup();
  }

  @Override
  public void startEndpoint() throws IOException {
    final ServerBootstrap bootstrap = new ServerBootstrap()
        .group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .childOption(ChannelOption.TCP_NODELAY, true)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel sc) throws Exception {
            initPipeline(sc.pipeline(), new FrameHandler(false, null));
          }
        });
    try {
      serverChannel = bootstrap.bind(address.getHost(), address.getPort()).sync().channel();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while binding " + address, ex);
    } catch (Exception ex) {
      throw new IOException("Unable to bind " + address, ex);
    }
    running = true;
    LOGGER.debug("Listening on " + address);
  }

  private void initPipeline(ChannelPipeline cp, FrameHandler handler) {
    cp.addLast(new LengthFieldBasedFrameDecoder(maxFrameSize, 0, 4, 0, 4));
    cp.addLast(new LengthFieldPrepender(4));
    cp.addLast(new ByteArrayDecoder());
    cp.addLast(new ByteArrayEncoder());
    cp.addLast(handler);
  }

  @Override
  public PeerId connect(URI remote) throws IOException {
    if (!running) {
      throw new IOException("transport is not running");
    }
    CompletableFuture<PeerId> handshake = new CompletableFuture<>();
    Bootstrap b = new Bootstrap();
    b.group(workerGroup)
        .channel(NioSocketChannel.class)
        .option(ChannelOption.TCP_NODELAY, true)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout))
        .handler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) throws Exception {
            initPipeline(ch.pipeline(), new FrameHandler(true, handshake));
          }
        });
    ChannelFuture connectFuture = b.connect(remote.getHost(), remote.getPort());
    try {
      return handshake.get(connectTimeout, TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      closeQuietly(connectFuture.channel());
      throw new IOException("Interrupted while connecting to " + remote, ex);
    } catch (TimeoutException ex) {
      closeQuietly(connectFuture.channel());
      throw new IOException("Handshake with " + remote + " timed out", ex);
    } catch (ExecutionException ex) {
      closeQuietly(connectFuture.channel());
      throw new IOException("Unable to connect to " + remote, ex.getCause());
    }
  }

  @Override
  public void send(PeerId peer, byte[] buf) throws IOException {
    Channel channel = channels.get(peer);
    if (channel == null || !channel.isActive()) {
      throw new IOException("not connected to " + peer);
    }
    ChannelFuture write = channel.writeAndFlush(buf);
    try {
      if (!write.await(connectTimeout)) {
        throw new IOException("write to " + peer + " timed out");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while writing to " + peer, ex);
    }
    if (!write.isSuccess()) {
      throw new IOException("write to " + peer + " failed", write.cause());
    }
  }

  @Override
  public void close(PeerId peer) {
    Channel channel = channels.remove(peer);
    if (channel != null) {
      closeQuietly(channel);
    }
  }

  private static void closeQuietly(Channel channel) {
    channel.attr(CLOSING).set(Boolean.TRUE);
    channel.close();
  }

  @Override
  public void shutdown() {
    running = false;
    for (PeerId peer : new ArrayList<>(channels.keySet())) {
      close(peer);
    }
    if (serverChannel != null) {
      serverChannel.close().awaitUninterruptibly(connectTimeout);
    }
    workerGroup.shutdownGracefully(0, connectTimeout, TimeUnit.MILLISECONDS);
    bossGroup.shutdownGracefully(0, connectTimeout, TimeUnit.MILLISECONDS);
  }

  static byte[] hello(PeerId id, URI address) {
    return (id.getId() + "\n" + address.toASCIIString()).getBytes(StandardCharsets.UTF_8);
  }

  private static final class Hello {
    private final PeerId id;
    private final URI address;

    private Hello(PeerId id, URI address) {
      this.id = id;
      this.address = address;
    }

    static Hello parse(byte[] frame) throws IOException {
      String text = new String(frame, StandardCharsets.UTF_8);
      int split = text.indexOf('\n');
      if (split <= 0 || split == text.length() - 1) {
        throw new IOException("malformed hello");
      }
      try {
        return new Hello(new PeerId(text.substring(0, split)), new URI(text.substring(split + 1)));
      } catch (URISyntaxException | IllegalArgumentException ex) {
        throw new IOException("malformed hello", ex);
      }
    }
  }

  /** One per channel: runs the hello exchange, then passes frames up. */
  private final class FrameHandler extends SimpleChannelInboundHandler<byte[]> {
    private final boolean outbound;
    private final CompletableFuture<PeerId> handshake;
    private PeerId peer;

    FrameHandler(boolean outbound, CompletableFuture<PeerId> handshake) {
      this.outbound = outbound;
      this.handshake = handshake;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
      ctx.writeAndFlush(hello(me, address));
      super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, byte[] frame) throws Exception {
      if (peer != null) {
        fireBytesReceived(peer, frame);
        return;
      }
      Hello hello = Hello.parse(frame);
      peer = hello.id;
      boolean first = register(ctx.channel(), hello.id);
      if (outbound) {
        handshake.complete(hello.id);
      } else if (first) {
        fireConnectionOpened(hello.id, hello.address);
      }
    }

    /** @return true when this is the only channel to the peer */
    private boolean register(Channel channel, PeerId id) {
      Channel existing = channels.putIfAbsent(id, channel);
      if (existing == null || existing == channel) {
        return true;
      }
      PeerId dialer = outbound ? me : id;
      PeerId smaller = me.compareTo(id) <= 0 ? me : id;
      if (dialer.equals(smaller)) {
        channels.put(id, channel);
        closeQuietly(existing);
      } else {
        closeQuietly(channel);
      }
      return false;
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
      if (handshake != null && !handshake.isDone()) {
        handshake.completeExceptionally(new IOException("connection closed during handshake"));
      }
      Channel channel = ctx.channel();
      if (peer != null && channels.remove(peer, channel) && !Boolean.TRUE.equals(channel.attr(CLOSING).get())) {
        fireConnectionClosed(peer);
      }
      super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
      LOGGER.debug("Channel to " + peer + " failed", cause);
      if (handshake != null && !handshake.isDone()) {
        handshake.completeExceptionally(cause);
      }
      ctx.close();
    }
  }
}
